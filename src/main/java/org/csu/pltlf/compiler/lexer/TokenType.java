package org.csu.pltlf.compiler.lexer;

/**
 * @description: 公式中所有可能出现的"单词"的分类
 *
 * 前半部分是命题逻辑共享的 Token，LTLf 词法分析器在此基础上增加时序算子。
 */
public enum TokenType {
    // ---- 命题逻辑 (shared propositional tokens) ----
    NOT,          // ! 或 ~
    AND,          // & 或 &&
    OR,           // | 或 ||
    IMPLY,        // -> 或 >>
    EQUIVALENCE,  // <->
    TRUE,         // true / True / TRUE
    FALSE,        // false / False / FALSE
    LPAREN,       // (
    RPAREN,       // )
    SYMBOL,       // [a-z][a-z0-9_]*

    // ---- 未来时序算子 ----
    UNTIL,        // U
    RELEASE,      // R
    ALWAYS,       // G
    EVENTUALLY,   // F
    NEXT,         // X
    WEAK_NEXT,    // WX

    // ---- 过去时序算子 ----
    SINCE,        // S
    TRIGGER,      // T
    HISTORICALLY, // H
    ONCE,         // O
    BEFORE,       // Y
    WBEFORE,      // WY

    // ---- 迹的端点 ----
    LAST,         // last, 不区分大小写
    INIT,         // init, 不区分大小写

    // ---- 特殊 Token ----
    EOF;

    public boolean isPropositional() {
        return ordinal() <= SYMBOL.ordinal();
    }
}
