package org.csu.pltlf.compiler.parser;

import lombok.Getter;

/**
 * 解析器的配置项，不可变。
 *
 * historicallyEnabled: H 是否作为一元算子参与解析；关闭时遇到 H 直接报语法错误。
 * verbose: 是否打印 [DEBUG] 诊断信息。
 */
@Getter
public final class ParserOptions {

    private static final ParserOptions DEFAULTS = new ParserOptions(true, false);

    private final boolean historicallyEnabled;
    private final boolean verbose;

    public ParserOptions(boolean historicallyEnabled, boolean verbose) {
        this.historicallyEnabled = historicallyEnabled;
        this.verbose = verbose;
    }

    public static ParserOptions defaults() {
        return DEFAULTS;
    }

    public ParserOptions withHistorically(boolean enabled) {
        return new ParserOptions(enabled, verbose);
    }

    public ParserOptions withVerbose(boolean enabled) {
        return new ParserOptions(historicallyEnabled, enabled);
    }

    @Override
    public String toString() {
        return "ParserOptions[historicallyEnabled=" + historicallyEnabled + ", verbose=" + verbose + "]";
    }
}
