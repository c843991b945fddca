package com.maxdemarzi.kmap.quine;

import java.time.Duration;

public class MinimizationTimeoutException extends RuntimeException {

    public MinimizationTimeoutException(Duration budget, Throwable cause) {
        super("Minimization did not finish within " + budget.toMillis() + " ms", cause);
    }
}
