package com.mwpbound.analyzer.lang;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON form of a program.
 *
 * <pre>
 * { "functions": [ { "name": "foo", "params": ["x", "y"],
 *                    "body": [ { "kind": "assign", "target": "x",
 *                                "value": { "kind": "binary", "op": "+", "left": "y", "right": 1 } } ] } ] }
 * </pre>
 *
 * Every node is an object with a {@code kind}. As a shorthand a JSON string is a variable and
 * a JSON number a constant, and a JSON array in statement position is a block.
 */
public class ProgramReader {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(Program.class, new ProgramDeserializer())
            .registerTypeAdapter(FunctionDef.class, new FunctionDeserializer())
            .registerTypeAdapter(Stmt.class, new StmtDeserializer())
            .registerTypeAdapter(Block.class, new BlockDeserializer())
            .registerTypeAdapter(Expr.class, new ExprDeserializer())
            .create();

    /**
     * Reads and deserializes a program from the given path.
     *
     * @throws ProgramReadException if the file is missing or is not a valid program
     */
    public Program read(Path path) {
        if (!path.toFile().exists()) {
            throw new ProgramReadException("Program file not found: " + path);
        }
        try (FileReader reader = new FileReader(path.toFile())) {
            return decode(reader, path.toString());
        } catch (FileNotFoundException e) {
            throw new ProgramReadException("Program file not found: " + path, e);
        } catch (IOException e) {
            throw new ProgramReadException("Failed to read program: " + path + ": " + e.getMessage(), e);
        }
    }

    public Program parse(String json) {
        return decode(new StringReader(json), "<string>");
    }

    private Program decode(Reader reader, String source) {
        Program program;
        try {
            program = GSON.fromJson(reader, Program.class);
        } catch (JsonParseException e) {
            throw new ProgramReadException("Invalid program in " + source + ": " + e.getMessage(), e);
        }
        if (program == null) {
            throw new ProgramReadException("Program file is empty or invalid JSON: " + source);
        }
        return program;
    }

    public static class ProgramReadException extends RuntimeException {
        public ProgramReadException(String message) { super(message); }
        public ProgramReadException(String message, Throwable cause) { super(message, cause); }
    }

    // --- Deserializers ---

    private static class ProgramDeserializer implements JsonDeserializer<Program> {
        @Override
        public Program deserialize(JsonElement json, Type type, JsonDeserializationContext ctx) {
            JsonObject obj = object(json, "program");
            List<FunctionDef> functions = new ArrayList<>();
            if (obj.has("functions") && !obj.get("functions").isJsonNull()) {
                for (JsonElement f : array(obj, "functions")) {
                    if (f.isJsonNull()) throw new JsonParseException("Null function in " + obj);
                    functions.add(ctx.deserialize(f, FunctionDef.class));
                }
            }
            return new Program(functions);
        }
    }

    private static class FunctionDeserializer implements JsonDeserializer<FunctionDef> {
        @Override
        public FunctionDef deserialize(JsonElement json, Type type, JsonDeserializationContext ctx) {
            JsonObject obj = object(json, "function");
            List<String> params = new ArrayList<>();
            if (obj.has("params") && !obj.get("params").isJsonNull()) {
                for (JsonElement p : array(obj, "params")) params.add(asString(p, "parameter"));
            }
            JsonElement body = obj.get("body");
            Block block = body == null || body.isJsonNull() ? null : ctx.deserialize(body, Block.class);
            return new FunctionDef(string(obj, "name"), params, block);
        }
    }

    private static class BlockDeserializer implements JsonDeserializer<Block> {
        @Override
        public Block deserialize(JsonElement json, Type type, JsonDeserializationContext ctx) {
            if (json.isJsonArray()) return new Block(stmts(json.getAsJsonArray(), ctx));
            Stmt stmt = ctx.deserialize(json, Stmt.class);
            return stmt instanceof Block ? (Block) stmt : Block.of(stmt);
        }
    }

    private static class StmtDeserializer implements JsonDeserializer<Stmt> {
        @Override
        public Stmt deserialize(JsonElement json, Type type, JsonDeserializationContext ctx) {
            if (json.isJsonArray()) return new Block(stmts(json.getAsJsonArray(), ctx));
            JsonObject obj = object(json, "statement");
            String kind = string(obj, "kind");
            switch (kind) {
                case "assign":
                    return new Assign(expr(obj, "target", ctx), optString(obj, "op"), expr(obj, "value", ctx));
                case "expr":
                    return new ExprStmt(expr(obj, "expr", ctx));
                case "decl":
                    return new Decl(string(obj, "name"), optExpr(obj, "init", ctx));
                case "if":
                    return new If(expr(obj, "cond", ctx), stmt(obj, "then", ctx), optStmt(obj, "else", ctx));
                case "while":
                    return new While(expr(obj, "cond", ctx), stmt(obj, "body", ctx));
                case "do_while":
                    return new DoWhile(stmt(obj, "body", ctx), expr(obj, "cond", ctx));
                case "loop":
                    return new Loop(string(obj, "bound"), stmt(obj, "body", ctx));
                case "block":
                    return new Block(obj.has("stmts") ? stmts(array(obj, "stmts"), ctx) : List.of());
                case "return":
                    return new Return(optExpr(obj, "value", ctx));
                case "break":
                    return new Break();
                case "continue":
                    return new Continue();
                case "skip":
                    return new Skip();
                default:
                    throw new JsonParseException("Unknown statement kind: " + kind);
            }
        }
    }

    private static class ExprDeserializer implements JsonDeserializer<Expr> {
        @Override
        public Expr deserialize(JsonElement json, Type type, JsonDeserializationContext ctx) {
            if (json.isJsonPrimitive()) {
                JsonPrimitive p = json.getAsJsonPrimitive();
                if (p.isNumber()) return new Const(p.getAsString());
                if (p.isString()) return new Var(p.getAsString());
                throw new JsonParseException("Not an expression: " + json);
            }
            JsonObject obj = object(json, "expression");
            String kind = string(obj, "kind");
            switch (kind) {
                case "var":
                    return new Var(string(obj, "name"));
                case "const":
                    String value = optString(obj, "value");
                    return new Const(value == null ? "0" : value);
                case "binary":
                    return new Binary(string(obj, "op"), expr(obj, "left", ctx), expr(obj, "right", ctx));
                case "unary":
                    return new Unary(string(obj, "op"), expr(obj, "expr", ctx));
                case "cast":
                    return new Cast(optString(obj, "type"), expr(obj, "expr", ctx));
                case "call":
                    List<Expr> args = new ArrayList<>();
                    if (obj.has("args")) {
                        for (JsonElement a : array(obj, "args")) {
                            if (a.isJsonNull()) throw new JsonParseException("Null argument in " + obj);
                            args.add(ctx.deserialize(a, Expr.class));
                        }
                    }
                    return new Call(string(obj, "name"), args);
                default:
                    throw new JsonParseException("Unknown expression kind: " + kind);
            }
        }
    }

    // --- Helpers ---

    private static List<Stmt> stmts(JsonArray array, JsonDeserializationContext ctx) {
        List<Stmt> out = new ArrayList<>(array.size());
        for (JsonElement e : array) {
            if (e.isJsonNull()) throw new JsonParseException("Null statement in " + array);
            out.add(ctx.deserialize(e, Stmt.class));
        }
        return out;
    }

    private static JsonObject object(JsonElement json, String what) {
        if (!json.isJsonObject()) throw new JsonParseException("Expected " + what + " object, got: " + json);
        return json.getAsJsonObject();
    }

    private static String string(JsonObject obj, String field) {
        String value = optString(obj, field);
        if (value == null) throw new JsonParseException("Missing field '" + field + "' in " + obj);
        return value;
    }

    private static String optString(JsonObject obj, String field) {
        JsonElement e = obj.get(field);
        return e == null || e.isJsonNull() ? null : asString(e, "'" + field + "'");
    }

    private static String asString(JsonElement e, String what) {
        if (!e.isJsonPrimitive()) throw new JsonParseException("Expected " + what + " to be a string, got: " + e);
        return e.getAsString();
    }

    private static JsonArray array(JsonObject obj, String field) {
        JsonElement e = obj.get(field);
        if (e == null || !e.isJsonArray()) throw new JsonParseException("Expected '" + field + "' array in " + obj);
        return e.getAsJsonArray();
    }

    private static Expr expr(JsonObject obj, String field, JsonDeserializationContext ctx) {
        Expr e = optExpr(obj, field, ctx);
        if (e == null) throw new JsonParseException("Missing field '" + field + "' in " + obj);
        return e;
    }

    private static Expr optExpr(JsonObject obj, String field, JsonDeserializationContext ctx) {
        JsonElement e = obj.get(field);
        return e == null || e.isJsonNull() ? null : ctx.deserialize(e, Expr.class);
    }

    private static Stmt stmt(JsonObject obj, String field, JsonDeserializationContext ctx) {
        Stmt s = optStmt(obj, field, ctx);
        if (s == null) throw new JsonParseException("Missing field '" + field + "' in " + obj);
        return s;
    }

    private static Stmt optStmt(JsonObject obj, String field, JsonDeserializationContext ctx) {
        JsonElement e = obj.get(field);
        return e == null || e.isJsonNull() ? null : ctx.deserialize(e, Stmt.class);
    }
}
