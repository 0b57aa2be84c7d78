package com.p14n.pgtopics.data;

/**
 * Derives topic names from payload types.
 */
public class TopicNames {

    private TopicNames() {
    }

    /**
     * Converts the simple name of the type to snake case, eg.
     * {@code UserCreated} becomes {@code user_created} and {@code HTTPRequest}
     * becomes {@code http_request}.
     *
     * @param type the payload type
     * @return the topic name
     */
    public static String of(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        String name = type.getSimpleName();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a topic name from anonymous type " + type.getName());
        }
        StringBuilder sb = new StringBuilder();
        char[] chars = name.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (Character.isUpperCase(c)) {
                boolean prevLower = i > 0 && (Character.isLowerCase(chars[i - 1]) || Character.isDigit(chars[i - 1]));
                boolean nextLower = i + 1 < chars.length && Character.isLowerCase(chars[i + 1]);
                boolean prevUpper = i > 0 && Character.isUpperCase(chars[i - 1]);
                if (sb.length() > 0 && (prevLower || (prevUpper && nextLower))) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else if (c == '_' || c == '$') {
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') {
                    sb.append('_');
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
