package com.tlang.ir.pass;

import java.util.Collections;
import java.util.List;

/**
 * 降级后的 IR 不满足 SSA 不变量。
 */
public class IrVerificationException extends RuntimeException {

    private final List<String> violations;

    public IrVerificationException(List<String> violations) {
        super("IR verification failed: " + String.join("; ", violations));
        this.violations = Collections.unmodifiableList(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
