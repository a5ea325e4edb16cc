package com.mwpbound.analyzer;

import com.mwpbound.analyzer.lang.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static com.mwpbound.analyzer.lang.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

class ProgramReaderTest {

    private static final Path PROGRAMS =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/programs");

    private final ProgramReader reader = new ProgramReader();

    @Test
    void readsFixtureIntoAst() {
        Program program = reader.read(PROGRAMS.resolve("example3_1.json"));
        FunctionDef expected = function("foo", List.of("X1", "X2", "X3"),
            whileLoop(op(">", var("X"), num(0)),
                assign("X1", add(var("X2"), var("X3")))));
        assertEquals(List.of(expected), program.functions());
    }

    @Test
    void readsEveryStatementKind() {
        String json = """
            {
              "functions": [
                {
                  "name": "all",
                  "params": ["a"],
                  "body": [
                    { "kind": "decl", "name": "t", "init": 0 },
                    { "kind": "assign", "target": "a", "op": "*=", "value": "t" },
                    { "kind": "expr", "expr": { "kind": "unary", "op": "p++", "expr": "a" } },
                    { "kind": "if", "cond": "a", "then": [ { "kind": "break" } ] },
                    { "kind": "do_while", "cond": "a", "body": { "kind": "continue" } },
                    { "kind": "loop", "bound": "a", "body": [ { "kind": "skip" } ] },
                    { "kind": "block", "stmts": [] },
                    { "kind": "return" }
                  ]
                }
              ]
            }
            """;
        List<Stmt> body = reader.parse(json).functions().get(0).body().stmts();
        assertEquals(8, body.size());
        assertEquals(new Decl("t", Const.of(0)), body.get(0));
        assertEquals(assign("a", "*=", var("t")), body.get(1));
        assertEquals(inc("a"), body.get(2));
        assertEquals(new If(var("a"), block(new Break()), null), body.get(3));
        assertEquals(new DoWhile(new Continue(), var("a")), body.get(4));
        assertEquals(loop("a", new Skip()), body.get(5));
        assertEquals(block(), body.get(6));
        assertEquals(new Return(null), body.get(7));
    }

    @Test
    void readsExpressionObjects() {
        String json = """
            { "functions": [ { "name": "f", "body": [
                { "kind": "assign", "target": { "kind": "var", "name": "x" },
                  "value": { "kind": "cast", "type": "long",
                             "expr": { "kind": "call", "name": "g", "args": [ { "kind": "const", "value": "7" } ] } } }
            ] } ] }
            """;
        FunctionDef f = reader.parse(json).functions().get(0);
        assertEquals(List.of(), f.params());
        Assign a = (Assign) f.body().stmts().get(0);
        assertEquals(new Cast("long", new Call("g", List.of(new Const("7")))), a.value());
    }

    @Test
    void programFunctionLookup() {
        Program program = reader.read(PROGRAMS.resolve("unsupported.json"));
        assertTrue(program.function("copy").isPresent());
        assertTrue(program.function("missing").isEmpty());
    }

    @Test
    void unknownKindThrowsProgramReadException() {
        String json = """
            { "functions": [ { "name": "f", "body": [ { "kind": "goto" } ] } ] }
            """;
        assertThrows(ProgramReader.ProgramReadException.class, () -> reader.parse(json));
    }

    @Test
    void missingFieldThrowsProgramReadException() {
        String json = """
            { "functions": [ { "name": "f", "body": [ { "kind": "assign", "target": "x" } ] } ] }
            """;
        assertThrows(ProgramReader.ProgramReadException.class, () -> reader.parse(json));
    }

    @Test
    void functionWithoutNameThrowsProgramReadException() {
        String json = """
            { "functions": [ { "params": ["x"], "body": [] } ] }
            """;
        ProgramReader.ProgramReadException e =
            assertThrows(ProgramReader.ProgramReadException.class, () -> reader.parse(json));
        assertTrue(e.getMessage().contains("name"));
    }

    @Test
    void nonStringFieldThrowsProgramReadException() {
        String kindObject = """
            { "functions": [ { "name": "f", "body": [ { "kind": {} } ] } ] }
            """;
        assertThrows(ProgramReader.ProgramReadException.class, () -> reader.parse(kindObject));

        String paramArray = """
            { "functions": [ { "name": "f", "params": [["x"]], "body": [] } ] }
            """;
        assertThrows(ProgramReader.ProgramReadException.class, () -> reader.parse(paramArray));
    }

    @Test
    void nullEntriesThrowProgramReadException() {
        assertThrows(ProgramReader.ProgramReadException.class,
            () -> reader.parse("{ \"functions\": [ null ] }"));
        assertThrows(ProgramReader.ProgramReadException.class,
            () -> reader.parse("{ \"functions\": [ { \"name\": \"f\", \"body\": [ null ] } ] }"));
    }

    @Test
    void fileNotFoundThrowsProgramReadException() {
        Path missing = Path.of("/tmp/does-not-exist-program.json");
        assertThrows(ProgramReader.ProgramReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsProgramReadException(@TempDir Path tmp) throws IOException {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(ProgramReader.ProgramReadException.class, () -> reader.read(empty));
    }
}
