package org.schemaforge.render;

/**
 * Quoting helpers for generated shell invocations.
 */
public final class ShellCommands {

    private ShellCommands() {
    }

    /**
     * Wraps {@code text} in double quotes, escaping what the shell would otherwise interpret.
     */
    public static String doubleQuoted(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            if (c == '"' || c == '\\' || c == '$' || c == '`') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    /**
     * Feeds {@code script} to {@code command} on stdin. A quoted delimiter disables shell expansion.
     */
    public static String heredoc(String command, String script, boolean expand) {
        String delimiter = expand ? "SQL" : "'SQL'";
        String body = script.endsWith("\n") ? script : script + "\n";
        return command + " <<" + delimiter + "\n" + body + "SQL";
    }
}
