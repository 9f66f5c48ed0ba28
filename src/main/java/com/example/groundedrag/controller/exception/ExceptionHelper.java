package com.example.groundedrag.controller.exception;

public final class ExceptionHelper {

    private ExceptionHelper() {
    }

    /**
     * Innermost frame of the exception as {@code class:line}, or null when the stack is unavailable.
     */
    public static String getTrace(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        StackTraceElement[] st = root.getStackTrace();
        if (st != null && st.length > 0) {
            StackTraceElement e = st[0];
            return e.getClassName() + ":" + e.getLineNumber();
        }
        return null;
    }
}
