package ilhost.runtime.types;

import java.util.List;

/**
 * 类型实参列表的标识拼接
 */
public final class TypeIds {

    private TypeIds() {}

    /** 实参标识以 ',' 连接，空列表为 "void" */
    public static String hashArguments(List<? extends TypeReference> arguments) {
        if (arguments.isEmpty()) return "void";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(arguments.get(i).typeId());
        }
        return sb.toString();
    }
}
