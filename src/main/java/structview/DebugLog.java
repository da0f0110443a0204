package structview;

/**
 * Opt-in diagnostic logger. Off by default; {@code --debug} or the Preferences dialog turns it on.
 * Lines go to stdout, prefixed with the logging thread so EDT callbacks stand out.
 */
public final class DebugLog {
    private static volatile boolean enabled = false;

    private DebugLog() {}

    public static void setEnabled(boolean on) {
        enabled = on;
    }

    public static boolean isEnabled() {
        return enabled;
    }

    public static void log(String msg) {
        if (!enabled) return;
        System.out.println("[structview " + Thread.currentThread().getName() + "] " + msg);
    }

    public static void log(String fmt, Object... args) {
        if (!enabled) return;
        log(String.format(fmt, args));
    }

    public static void log(String msg, Throwable error) {
        if (!enabled) return;
        log(msg + ": " + error);
        error.printStackTrace(System.out);
    }
}
