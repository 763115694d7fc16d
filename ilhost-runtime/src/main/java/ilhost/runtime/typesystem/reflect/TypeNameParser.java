package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.NameResolutionException;

import java.util.ArrayList;
import java.util.List;

/**
 * 程序集限定类型名解析：{@code Ns.Name`1[[Arg, Unit],[Arg2]][], Unit}。
 */
public final class TypeNameParser {

    private TypeNameParser() {}

    public static ParsedTypeName parse(String qualifiedName) {
        if (qualifiedName == null || qualifiedName.trim().isEmpty()) {
            throw new NameResolutionException("Type name must not be empty");
        }
        String text = qualifiedName.trim();

        String loadUnit = null;
        int comma = topLevelIndexOf(text, ',');
        if (comma >= 0) {
            loadUnit = text.substring(comma + 1).trim();
            text = text.substring(0, comma).trim();
        }

        int arrayRank = 0;
        while (text.endsWith("[]")) {
            arrayRank++;
            text = text.substring(0, text.length() - 2).trim();
        }

        List<ParsedTypeName> arguments = new ArrayList<>();
        int open = text.indexOf('[');
        if (open >= 0) {
            if (!text.endsWith("]")) {
                throw new NameResolutionException("Malformed type name '" + qualifiedName + "'");
            }
            for (String argument : splitTopLevel(text.substring(open + 1, text.length() - 1))) {
                String trimmed = argument.trim();
                if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                    trimmed = trimmed.substring(1, trimmed.length() - 1);
                }
                arguments.add(parse(trimmed));
            }
            text = text.substring(0, open).trim();
        }
        return new ParsedTypeName(text, arguments, loadUnit, arrayRank);
    }

    private static int topLevelIndexOf(String text, char target) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') depth++;
            else if (c == ']') depth--;
            else if (c == target && depth == 0) return i;
        }
        return -1;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') depth++;
            else if (c == ']') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }
}
