package com.verilang.frontend.ast.path;

import com.verilang.frontend.ast.AstList;
import com.verilang.frontend.ast.AstNode;
import com.verilang.frontend.ast.expr.Expression;

/**
 * specify 路径的公共部分：极性与路径延迟
 */
public abstract class ModulePath extends AstNode {
    private final Polarity polarity;
    private final AstList<Expression> delayValue;

    protected ModulePath(Polarity polarity, AstList<Expression> delayValue) {
        this.polarity = polarity;
        this.delayValue = delayValue;
    }

    public Polarity getPolarity() {
        return polarity;
    }

    public AstList<Expression> getDelayValue() {
        return delayValue;
    }
}
