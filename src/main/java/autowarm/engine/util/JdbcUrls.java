package autowarm.engine.util;

import java.util.regex.Pattern;

/**
 * Helpers for JDBC URLs that end up in logs and API responses.
 */
public final class JdbcUrls {

    private static final Pattern USER_INFO = Pattern.compile("//[^/@]*@");
    private static final Pattern PASSWORD_PARAM = Pattern.compile("(?i)(password=)[^&;]*");

    private JdbcUrls() {
    }

    /** Strip credentials (user-info and password parameters) from a JDBC URL. */
    public static String redact(String url) {
        if (url == null) {
            return null;
        }
        String redacted = USER_INFO.matcher(url).replaceFirst("//***@");
        return PASSWORD_PARAM.matcher(redacted).replaceAll("$1***");
    }
}
