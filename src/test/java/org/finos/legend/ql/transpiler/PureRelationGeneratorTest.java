package org.finos.legend.ql.transpiler;

import org.finos.legend.ql.plan.Clause;
import org.finos.legend.ql.plan.DistinctClause;
import org.finos.legend.ql.plan.ExtendClause;
import org.finos.legend.ql.plan.FilterClause;
import org.finos.legend.ql.plan.JoinClause;
import org.finos.legend.ql.plan.LimitClause;
import org.finos.legend.ql.plan.OffsetClause;
import org.finos.legend.ql.plan.OrderByClause;
import org.finos.legend.ql.plan.RenameClause;
import org.finos.legend.ql.plan.SelectClause;
import org.finos.legend.ql.query.BackendUnsupportedException;
import org.finos.legend.ql.query.ErrorKind;
import org.finos.legend.ql.query.Pipeline;
import org.finos.legend.ql.query.Query;
import org.finos.legend.ql.store.Column;
import org.finos.legend.ql.store.ColumnType;
import org.finos.legend.ql.store.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.finos.legend.ql.plan.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Pure relation text generation.
 */
class PureRelationGeneratorTest {

    private final PureRelationGenerator generator = PureRelationGenerator.INSTANCE;

    private Table employees;
    private Table departments;

    @BeforeEach
    void setUp() {
        employees = new Table("test", "employees", List.of(
                Column.of("id", ColumnType.INTEGER),
                Column.of("name", ColumnType.STRING),
                Column.of("age", ColumnType.INTEGER),
                Column.of("salary", ColumnType.DOUBLE),
                Column.of("department_id", ColumnType.INTEGER)));
        departments = new Table("test", "departments", List.of(
                Column.of("dept_id", ColumnType.INTEGER),
                Column.of("dept_name", ColumnType.STRING),
                Column.of("location", ColumnType.STRING)));
    }

    private String render(Query query) {
        return generator.render(query.pipeline());
    }

    // ==================== Clauses ====================

    @Test
    @DisplayName("A source alone renders as database.table")
    void testFromOnly() {
        assertEquals("test.employees", render(Query.from(employees)));
    }

    @Test
    @DisplayName("project lists its columns")
    void testSelect() {
        // GIVEN: a projection of three columns
        Query query = Query.from(employees).select("id", "name", "age");

        // WHEN: rendering
        String pure = render(query);

        // THEN: the columns appear in order
        assertEquals("test.employees\n->project([id, name, age])", pure);
    }

    @Test
    @DisplayName("filter renders its parenthesized predicate")
    void testFilter() {
        assertEquals("test.employees\n->filter((age > 30))",
                render(Query.from(employees).filter(gt(col("age"), lit(30)))));
    }

    @Test
    @DisplayName("extend renders expression as alias")
    void testExtend() {
        assertEquals("test.employees\n->extend([(salary + 1000) as bonus])",
                render(Query.from(employees).extend(as("bonus", add(col("salary"), lit(1000))))));
    }

    @Test
    @DisplayName("rename renders old as new pairs")
    void testRename() {
        Map<String, String> renames = new LinkedHashMap<>();
        renames.put("id", "employee_id");
        renames.put("name", "employee_name");

        assertEquals("test.employees\n->rename([id as employee_id, name as employee_name])",
                render(Query.from(employees).rename(renames)));
    }

    @Test
    @DisplayName("groupBy renders keys then selections")
    void testGroupBy() {
        Query query = Query.from(employees)
                .groupBy(List.of(col("department_id"), avg(col("salary"))), cols("department_id"));

        assertEquals("test.employees\n->groupBy([department_id], [department_id, avg(salary)])", render(query));
    }

    @Test
    @DisplayName("groupBy with aliased aggregate")
    void testGroupByAlias() {
        Query query = Query.from(employees)
                .groupBy(List.of(col("department_id"), as("avg_salary", avg(col("salary")))), cols("department_id"));

        assertEquals("test.employees\n->groupBy([department_id], [department_id, avg(salary) as avg_salary])",
                render(query));
    }

    @Test
    @DisplayName("groupBy renders an aliased key as key as alias")
    void testGroupByAliasedKey() {
        Query query = Query.from(employees)
                .groupBy(List.of(as("dept", col("department_id")), as("avg_salary", avg(col("salary")))),
                        cols("department_id"));

        assertEquals("test.employees\n->groupBy([department_id], [department_id as dept, avg(salary) as avg_salary])",
                render(query));
    }

    @Test
    @DisplayName("groupBy appends its having predicate")
    void testGroupByHaving() {
        Query query = Query.from(employees).groupBy(
                List.of(col("department_id"), as("headcount", count(col("id")))),
                cols("department_id"),
                gt(col("headcount"), lit(5)));

        assertEquals("test.employees\n->groupBy([department_id], [department_id, count(id) as headcount], "
                + "(headcount > 5))", render(query));
    }

    @Test
    @DisplayName("sort renders the directions")
    void testOrderBy() {
        assertEquals("test.employees\n->sort([desc, asc])",
                render(Query.from(employees).orderBy(desc("salary"), asc("name"))));
    }

    @Test
    @DisplayName("take and drop render their counts")
    void testLimitOffset() {
        assertEquals("test.employees\n->take(10)", render(Query.from(employees).limit(10)));
        assertEquals("test.employees\n->drop(5)", render(Query.from(employees).offset(5)));
        assertEquals("test.employees\n->take(5)\n->drop(10)", render(Query.from(employees).limit(5).offset(10)));
    }

    @Test
    @DisplayName("join renders the other table, join type and condition")
    void testJoin() {
        assertEquals("test.employees\n->join(test.departments, INNER, (department_id == dept_id))",
                render(Query.from(employees).join(departments, eq(col("department_id"), col("dept_id")))));
        assertEquals("test.employees\n->join(test.departments, LEFT_OUTER, (department_id == dept_id))",
                render(Query.from(employees).leftJoin(departments, eq(col("department_id"), col("dept_id")))));
    }

    @Test
    @DisplayName("distinct has no Pure relation form")
    void testDistinctUnsupported() {
        Pipeline pipeline = Query.from(employees).distinct("department_id").pipeline();

        BackendUnsupportedException e = assertThrows(BackendUnsupportedException.class,
                () -> generator.render(pipeline));
        assertEquals(ErrorKind.BACKEND_UNSUPPORTED, e.kind());
        assertEquals("distinct", e.subject());
    }

    @Test
    @DisplayName("Complex pipeline renders each clause on its own line")
    void testComplexQuery() {
        Query query = Query.from(employees)
                .select("name", "salary", "age")
                .filter(gt(col("age"), lit(30)))
                .extend(as("bonus", add(col("salary"), lit(1000))))
                .orderBy(desc("salary"))
                .limit(10);

        assertEquals("test.employees\n->project([name, salary, age])\n->filter((age > 30))"
                + "\n->extend([(salary + 1000) as bonus])\n->sort([desc])\n->take(10)", render(query));
    }

    @Test
    @DisplayName("Rendering a longer pipeline appends exactly the new clause's suffix")
    void testSuffixComposition() {
        List<Clause> clauses = List.of(
                new SelectClause(cols("id", "name", "salary", "department_id")),
                new FilterClause(and(gt(col("salary"), lit(1000.0)), like(col("name"), lit("J%")))),
                new ExtendClause(List.of(as("raise", multiply(col("salary"), lit(0.05))))),
                new RenameClause(List.of(as("dept", col("department_id")))),
                JoinClause.inner(departments, eq(col("dept"), col("dept_id"))),
                new OrderByClause(List.of(asc("name"))),
                new OffsetClause(2),
                new LimitClause(3));

        Pipeline pipeline = Pipeline.from(employees);
        for (Clause clause : clauses) {
            Pipeline next = pipeline.append(clause);
            assertEquals(generator.render(pipeline) + generator.renderSuffix(clause), generator.render(next));
            pipeline = next;
        }
    }

    @Test
    @DisplayName("Concurrent renders of one pipeline produce identical text")
    void testConcurrentRendering() throws Exception {
        Pipeline pipeline = Query.from(employees)
                .filter(or(lt(col("age"), lit(25)), gt(col("age"), lit(60))))
                .extend(as("band", ifThenElse(gt(col("salary"), lit(5000.0)), lit("high"), lit("low"))))
                .orderBy(desc("salary"))
                .limit(100)
                .pipeline();
        String expected = generator.render(pipeline);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> generator.render(pipeline));
            }
            for (Future<String> result : executor.invokeAll(tasks)) {
                assertEquals(expected, result.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    // ==================== Expressions ====================

    @Test
    @DisplayName("Nested arithmetic is fully parenthesized")
    void testMathExpression() {
        Query query = Query.from(employees)
                .extend(as("calculation", add(multiply(col("salary"), lit(2)), divide(col("age"), lit(10)))));

        assertEquals("test.employees\n->extend([((salary * 2) + (age / 10)) as calculation])", render(query));
    }

    @Test
    @DisplayName("Conditional renders as if(test, then, else)")
    void testConditional() {
        Query query = Query.from(employees)
                .extend(as("status", ifThenElse(gt(col("age"), lit(30)), lit("Senior"), lit("Junior"))));

        assertEquals("test.employees\n->extend([if((age > 30), 'Senior', 'Junior') as status])", render(query));
    }

    @Test
    @DisplayName("Aggregate functions render as calls")
    void testFunctions() {
        Query query = Query.from(employees)
                .extend(as("count", count(col("id"))), as("avg_salary", avg(col("salary"))));

        assertEquals("test.employees\n->extend([count(id) as count, avg(salary) as avg_salary])", render(query));
    }

    @Test
    @DisplayName("Literals render in Pure syntax")
    void testLiterals() {
        assertEquals("42", generator.renderExpression(lit(42)));
        assertEquals("9000000000", generator.renderExpression(lit(9_000_000_000L)));
        assertEquals("2.5", generator.renderExpression(lit(2.5)));
        assertEquals("true", generator.renderExpression(lit(true)));
        assertEquals("'O\\'Brien'", generator.renderExpression(lit("O'Brien")));
        assertEquals("'C:\\\\'", generator.renderExpression(lit("C:\\")));
        assertEquals("'a\\\\\\'b'", generator.renderExpression(lit("a\\'b")));
        assertEquals("%2024-01-15%", generator.renderExpression(lit(LocalDate.of(2024, 1, 15))));
        assertEquals("%2024-01-15T09:30:00%",
                generator.renderExpression(lit(LocalDateTime.of(2024, 1, 15, 9, 30))));
    }

    @Test
    @DisplayName("Predicates render with their Pure operators")
    void testPredicates() {
        assertEquals("(name like 'J%')", generator.renderExpression(like(col("name"), lit("J%"))));
        assertEquals("(name is null)", generator.renderExpression(isNull(col("name"))));
        assertEquals("(name is not null)", generator.renderExpression(isNotNull(col("name"))));
        assertEquals("not((age > 30))", generator.renderExpression(not(gt(col("age"), lit(30)))));
        assertEquals("(department_id in [1, 2])",
                generator.renderExpression(in(col("department_id"), list(lit(1), lit(2)))));
        assertEquals("(department_id notIn [3])",
                generator.renderExpression(notIn(col("department_id"), list(lit(3)))));
        assertEquals("((age >= 18) && (age != 65))",
                generator.renderExpression(and(ge(col("age"), lit(18)), ne(col("age"), lit(65)))));
        assertEquals("((age < 18) || (age <= 0))",
                generator.renderExpression(or(lt(col("age"), lit(18)), le(col("age"), lit(0)))));
    }

    @Test
    @DisplayName("Modulo and power render as calls, bitwise operators infix")
    void testArithmeticOperators() {
        assertEquals("mod(id, 2)", generator.renderExpression(mod(col("id"), lit(2))));
        assertEquals("pow(salary, 2)", generator.renderExpression(pow(col("salary"), lit(2))));
        assertEquals("mod(id, 3)", generator.renderExpression(modulo(col("id"), lit(3))));
        assertEquals("(id & 1)", generator.renderExpression(bitAnd(col("id"), lit(1))));
        assertEquals("(id | 4)", generator.renderExpression(bitOr(col("id"), lit(4))));
        assertEquals("(salary - 10)", generator.renderExpression(subtract(col("salary"), lit(10))));
    }

    @Test
    @DisplayName("Distinct rendered alone is reported against this backend")
    void testDistinctSuffix() {
        BackendUnsupportedException e = assertThrows(BackendUnsupportedException.class,
                () -> generator.renderSuffix(DistinctClause.all()));
        assertTrue(e.getMessage().contains(generator.name()));
    }
}
