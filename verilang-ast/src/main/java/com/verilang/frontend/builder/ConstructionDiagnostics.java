package com.verilang.frontend.builder;

import com.google.gson.JsonObject;

/**
 * 将构造异常转换为 LSP 形式的诊断 JSON
 *
 * <p>构造层不跟踪源码位置，位置由调用方（解析器）提供，行列均从 1 开始。</p>
 */
public final class ConstructionDiagnostics {

    public static final String SOURCE = "verilang-ast";

    private static final int SEVERITY_ERROR = 1;

    private ConstructionDiagnostics() {
    }

    public static JsonObject toDiagnostic(AstException error, int line, int column, int length) {
        int startLine = line > 0 ? line - 1 : 0;
        int startCol = column > 0 ? column - 1 : 0;
        int endCol = startCol + Math.max(length, 1);

        JsonObject diag = new JsonObject();
        diag.add("range", createRange(startLine, startCol, startLine, endCol));
        diag.addProperty("severity", SEVERITY_ERROR);
        diag.addProperty("source", SOURCE);
        diag.addProperty("code", codeOf(error));
        diag.addProperty("message", error.getMessage());
        return diag;
    }

    /** 诊断代码：构造违例使用违例名，分配失败为 ALLOCATION_FAILED */
    static String codeOf(AstException error) {
        if (error instanceof AstConstructionException) {
            return ((AstConstructionException) error).getViolation().name();
        }
        return "ALLOCATION_FAILED";
    }

    private static JsonObject createRange(int startLine, int startCol, int endLine, int endCol) {
        JsonObject range = new JsonObject();
        range.add("start", createPosition(startLine, startCol));
        range.add("end", createPosition(endLine, endCol));
        return range;
    }

    private static JsonObject createPosition(int line, int character) {
        JsonObject pos = new JsonObject();
        pos.addProperty("line", line);
        pos.addProperty("character", character);
        return pos;
    }
}
