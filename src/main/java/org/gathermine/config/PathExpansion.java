package org.gathermine.config;

/**
 * Expands {@code ${VAR}} references in configured paths.
 * <p>
 * Java system properties are checked first, then environment variables, so a {@code -D} flag
 * can override the environment.
 * <p>
 * <strong>Examples:</strong>
 * <pre>
 * expandPath("${user.home}/SavedVariables")  → "/home/user/SavedVariables"
 * expandPath("${WOW_HOME}/_retail_/WTF")      → "/games/wow/_retail_/WTF"
 * expandPath("/absolute/path/no/variables")   → "/absolute/path/no/variables"
 * </pre>
 */
public final class PathExpansion {

    private PathExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * Expands environment variables and Java system properties in a path string.
     *
     * @param path the path potentially containing variables like {@code ${HOME}} or {@code ${user.home}}
     * @return the path with all variables expanded
     * @throws IllegalArgumentException if a variable is not defined or a reference is not closed
     */
    public static String expandPath(String path) {
        if (path == null || !path.contains("${")) {
            return path;
        }

        StringBuilder result = new StringBuilder();
        int pos = 0;

        while (pos < path.length()) {
            int startVar = path.indexOf("${", pos);
            if (startVar == -1) {
                result.append(path, pos, path.length());
                break;
            }

            result.append(path, pos, startVar);

            int endVar = path.indexOf('}', startVar + 2);
            if (endVar == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }

            String varName = path.substring(startVar + 2, endVar);
            String value = resolveVariable(varName);
            if (value == null) {
                throw new IllegalArgumentException(
                    "Undefined variable '${" + varName + "}' in path: " + path +
                    ". Check that environment variable or system property exists."
                );
            }

            result.append(value);
            pos = endVar + 1;
        }

        return result.toString();
    }

    private static String resolveVariable(String varName) {
        String value = System.getProperty(varName);
        if (value != null) {
            return value;
        }
        return System.getenv(varName);
    }
}
