package com.example.signalrag.controller.exception;

public final class ExceptionHelper {

    private ExceptionHelper() {
    }

    public static String getTrace(Throwable ex) {
        StackTraceElement[] st = ex.getStackTrace();
        if (st != null && st.length > 0) {
            StackTraceElement e = st[0];
            return e.getClassName() + ":" + e.getLineNumber();
        }
        return null;
    }
}
