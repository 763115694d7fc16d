package ilhost.runtime.types;

import java.util.ArrayList;
import java.util.List;

/**
 * 名称转义与拆分工具
 *
 * <p>转义规则：{@code `} → {@code $b}，{@code <} → {@code $l}，{@code >} → {@code $g}，
 * {@code .} {@code /} {@code +} → {@code _}。</p>
 */
public final class Names {

    private Names() {}

    /** 把成员名或类型名转义为可作为表键的形式 */
    public static String escape(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            switch (c) {
                case '`':
                    sb.append("$b");
                    break;
                case '<':
                    sb.append("$l");
                    break;
                case '>':
                    sb.append("$g");
                    break;
                case '.':
                case '/':
                case '+':
                    sb.append('_');
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 按 '.' 拆分为命名空间段，尖括号与方括号内的 '.' 不拆分；每段再转义。
     */
    public static List<String> split(String name) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '<' || c == '[') {
                depth++;
            } else if (c == '>' || c == ']') {
                depth--;
            } else if (c == '.' && depth == 0) {
                // ".ctor" 这类以点开头的段
                if (i == start) continue;
                result.add(escape(name.substring(start, i)));
                start = i + 1;
            }
        }
        result.add(escape(name.substring(start)));
        return result;
    }

    /** 最后一段（未转义） */
    public static String localName(String fullName) {
        int depth = 0;
        for (int i = fullName.length() - 1; i >= 0; i--) {
            char c = fullName.charAt(i);
            if (c == '>' || c == ']') depth++;
            else if (c == '<' || c == '[') depth--;
            else if (c == '.' && depth == 0 && i > 0) return fullName.substring(i + 1);
        }
        return fullName;
    }

    /** 除最后一段以外的部分，没有父级时返回空串 */
    public static String parentName(String fullName) {
        String local = localName(fullName);
        if (local.length() == fullName.length()) return "";
        return fullName.substring(0, fullName.length() - local.length() - 1);
    }

    /** 构造器与静态构造器是特殊名称 */
    public static boolean isSpecialName(String name) {
        return name.equals(".ctor") || name.equals("_ctor")
                || name.equals(".cctor") || name.equals("_cctor");
    }

    /** 构造器名称（转义前后两种形式） */
    public static boolean isConstructorName(String name) {
        return name.equals(".ctor") || name.equals("_ctor");
    }
}
