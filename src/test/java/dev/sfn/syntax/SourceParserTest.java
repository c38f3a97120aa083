package dev.sfn.syntax;

import dev.sfn.exceptions.UnsupportedOperation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceParserTest {

    @Test
    void parsesDecoratedFunctionWithKeywordArguments() {
        String source = """
            @schedule(expression="rate(1 day)", input_data={"a": 1})
            @export
            def main(data):
                data["x"] = 1
            """;

        SourceModule module = SourceParser.parse("example", source);

        assertThat(module.name()).isEqualTo("example");
        assertThat(module.functions()).hasSize(1);
        FunctionDef main = module.functions().get(0);
        assertThat(main.name()).isEqualTo("main");
        assertThat(main.params()).containsExactly("data");
        assertThat(main.position()).isEqualTo(new SourcePosition(3, 0));

        Decorator schedule = main.decorators().get(0);
        assertThat(schedule.name()).isEqualTo("schedule");
        assertThat(schedule.position()).isEqualTo(new SourcePosition(1, 0));
        assertThat(schedule.keywords()).extracting(Keyword::name).containsExactly("expression", "input_data");
        assertThat(schedule.keywords().get(0).value()).isEqualTo(new Expr.Str("rate(1 day)", new SourcePosition(1, 21)));

        Decorator export = main.decorators().get(1);
        assertThat(export.name()).isEqualTo("export");
        assertThat(export.keywords()).isEmpty();
    }

    @Test
    void parsesAssignmentToNestedSubscript() {
        var module = SourceParser.parse("m", """
            def main(data):
                data["foo"]["bar"] = [1, -2.5, True, None, "s"]
            """);

        Stmt stmt = module.functions().get(0).body().get(0);
        assertThat(stmt).isInstanceOf(Stmt.Assign.class);
        var assign = (Stmt.Assign) stmt;
        assertThat(assign.position()).isEqualTo(new SourcePosition(2, 4));

        var outer = (Expr.Subscript) assign.target();
        assertThat(outer.index()).isInstanceOfSatisfying(Expr.Str.class, s -> assertThat(s.value()).isEqualTo("bar"));
        var inner = (Expr.Subscript) outer.value();
        assertThat(inner.value()).isInstanceOfSatisfying(Expr.Name.class, n -> assertThat(n.id()).isEqualTo("data"));

        var list = (Expr.ListLit) assign.value();
        assertThat(list.elements()).hasSize(5);
        assertThat(list.elements().get(0)).isInstanceOfSatisfying(Expr.Num.class,
            n -> assertThat(n.value()).isEqualTo(1L));
        assertThat(list.elements().get(1)).isInstanceOf(Expr.UnaryOp.class);
        assertThat(list.elements().get(2)).isInstanceOf(Expr.Bool.class);
        assertThat(list.elements().get(3)).isInstanceOf(Expr.NoneLit.class);
    }

    @Test
    void parsesIfElifElseAsNestedIf() {
        var module = SourceParser.parse("m", """
            def main(data):
                if data["a"] == 1:
                    pass
                elif data["a"] > 2 and not data["b"]:
                    pass
                else:
                    return
            """);

        var top = (Stmt.If) module.functions().get(0).body().get(0);
        assertThat(top.test()).isInstanceOf(Expr.Compare.class);
        assertThat(top.body()).containsExactly(new Stmt.Pass(new SourcePosition(3, 8)));
        assertThat(top.orElse()).hasSize(1);

        var elif = (Stmt.If) top.orElse().get(0);
        assertThat(elif.position()).isEqualTo(new SourcePosition(4, 4));
        assertThat(elif.test()).isInstanceOfSatisfying(Expr.BoolOp.class, b -> {
            assertThat(b.op()).isEqualTo("and");
            assertThat(b.values().get(1)).isInstanceOf(Expr.UnaryOp.class);
        });
        assertThat(elif.orElse()).containsExactly(new Stmt.Return(null, new SourcePosition(7, 8)));
    }

    @Test
    void parsesTryWithHandlers() {
        var module = SourceParser.parse("m", """
            def main(data):
                try:
                    task("arn:aws:lambda:us-east-1:123456789012:function:work")
                except (States.Timeout, CustomError) as error:
                    pass
                except:
                    raise Failed("gave up")
            """);

        var tryStmt = (Stmt.Try) module.functions().get(0).body().get(0);
        assertThat(tryStmt.body()).hasSize(1);
        assertThat(tryStmt.handlers()).hasSize(2);

        Stmt.ExceptHandler first = tryStmt.handlers().get(0);
        assertThat(first.type()).isInstanceOf(Expr.TupleLit.class);
        assertThat(first.name()).isEqualTo("error");

        Stmt.ExceptHandler second = tryStmt.handlers().get(1);
        assertThat(second.type()).isNull();
        assertThat(second.body().get(0)).isInstanceOf(Stmt.Raise.class);
    }

    @Test
    void skipsCommentsBlankLinesAndDocstrings() {
        var module = SourceParser.parse("m", """
            \"\"\"Module docstring.\"\"\"

            # a comment
            def main(data):
                \"\"\"Does things.

                Over several lines.
                \"\"\"

                data["x"] = {  # continued
                    "a": 1,
                }
            """);

        var body = module.functions().get(0).body();
        assertThat(body).hasSize(2);
        assertThat(body.get(0)).isInstanceOf(Stmt.ExprStmt.class);
        assertThat(body.get(1)).isInstanceOf(Stmt.Assign.class);
        assertThat(body.get(1).position().line()).isEqualTo(10);
    }

    @Test
    void concatenatesAdjacentStringsAndDecodesEscapes() {
        var module = SourceParser.parse("m", """
            def main(data):
                data["s"] = "a\\tb" 'c\\'d'
            """);

        var assign = (Stmt.Assign) module.functions().get(0).body().get(0);
        assertThat(((Expr.Str) assign.value()).value()).isEqualTo("a\tbc'd");
    }

    @Test
    void decodesOctalHexAndUnicodeEscapes() {
        var module = SourceParser.parse("m", """
            def main(data):
                data["s"] = "\\101\\a\\012\\0\\v\\x41\\u00e9\\U0001F600\\q"
            """);

        var assign = (Stmt.Assign) module.functions().get(0).body().get(0);
        assertThat(((Expr.Str) assign.value()).value())
            .isEqualTo("A\u0007\n\0\u000bA\u00e9" + new String(Character.toChars(0x1F600)) + "\\q");
    }

    @Test
    void rejectsNamedUnicodeEscapes() {
        assertThatThrownBy(() -> SourceParser.parse("m", """
            def main(data):
                data["s"] = "\\N{BULLET}"
            """))
            .isInstanceOf(UnsupportedOperation.class)
            .hasMessageContaining("Named Unicode escapes");
    }

    @Test
    void parsesSingleLineSuite() {
        var module = SourceParser.parse("m", "def main(data): pass\n");

        assertThat(module.functions().get(0).body()).containsExactly(new Stmt.Pass(new SourcePosition(1, 16)));
    }

    @Test
    void parsesAugmentedAssignment() {
        var module = SourceParser.parse("m", """
            def main(data):
                data["n"] += 1
            """);

        assertThat(module.functions().get(0).body().get(0)).isInstanceOfSatisfying(Stmt.AugAssign.class,
            a -> assertThat(a.op()).isEqualTo("+="));
    }

    @Test
    void rejectsUnsupportedStatements() {
        assertThatThrownBy(() -> SourceParser.parse("m", """
            def main(data):
                for x in data["items"]:
                    pass
            """))
            .isInstanceOf(UnsupportedOperation.class)
            .hasMessageContaining("Unsupported statement 'for'")
            .satisfies(e -> assertThat(((UnsupportedOperation) e).position()).isEqualTo(new SourcePosition(2, 4)));
    }

    @Test
    void rejectsArithmetic() {
        assertThatThrownBy(() -> SourceParser.parse("m", """
            def main(data):
                data["x"] = 1 + 2
            """))
            .isInstanceOf(UnsupportedOperation.class)
            .hasMessageContaining("Arithmetic");
    }

    @Test
    void rejectsTopLevelStatements() {
        assertThatThrownBy(() -> SourceParser.parse("m", "x = 1\n"))
            .isInstanceOf(UnsupportedOperation.class)
            .hasMessageContaining("Only function definitions");
    }

    @Test
    void rejectsDuplicateFunctions() {
        assertThatThrownBy(() -> SourceParser.parse("m", """
            def main(data):
                pass

            def main(data):
                pass
            """))
            .isInstanceOf(UnsupportedOperation.class)
            .hasMessageContaining("already defined");
    }

    @Test
    void rejectsInconsistentIndentation() {
        assertThatThrownBy(() -> SourceParser.parse("m", "def main(data):\n        pass\n    pass\n"))
            .isInstanceOf(UnsupportedOperation.class)
            .hasMessageContaining("unindent");
    }

    @Test
    void rejectsMissingExcept() {
        assertThatThrownBy(() -> SourceParser.parse("m", """
            def main(data):
                try:
                    pass
                finally:
                    pass
            """))
            .isInstanceOf(UnsupportedOperation.class)
            .hasMessageContaining("'finally' clauses are not supported");
    }
}
