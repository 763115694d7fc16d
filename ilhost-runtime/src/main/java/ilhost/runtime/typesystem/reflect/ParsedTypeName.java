package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.typesystem.TypeSystem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解析后的程序集限定类型名。
 */
public final class ParsedTypeName {

    private final String typeName;
    private final List<ParsedTypeName> genericArguments;
    private final String loadUnitName;
    private final int arrayRank;

    ParsedTypeName(String typeName, List<ParsedTypeName> genericArguments, String loadUnitName, int arrayRank) {
        this.typeName = typeName;
        this.genericArguments = Collections.unmodifiableList(new ArrayList<>(genericArguments));
        this.loadUnitName = loadUnitName;
        this.arrayRank = arrayRank;
    }

    public String getTypeName() {
        return typeName;
    }

    public List<ParsedTypeName> getGenericArguments() {
        return genericArguments;
    }

    /** 未限定时为 null */
    public String getLoadUnitName() {
        return loadUnitName;
    }

    /** 类型名末尾 {@code []} 的个数 */
    public int getArrayRank() {
        return arrayRank;
    }

    /** 在指定单元（未限定时为核心单元）中解析、闭包并初始化 */
    public TypeDescriptor resolve(TypeSystem system) {
        LoadUnit unit = loadUnitName == null ? system.coreUnit() : system.getLoadUnit(loadUnitName);
        TypeDescriptor type = system.getType(unit, typeName);
        if (!genericArguments.isEmpty()) {
            Object[] arguments = new Object[genericArguments.size()];
            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = genericArguments.get(i).resolve(system);
            }
            type = system.close(type, arguments);
        }
        for (int i = 0; i < arrayRank; i++) {
            type = system.arrayOf(type);
        }
        return type;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(typeName);
        if (!genericArguments.isEmpty()) {
            sb.append('[');
            for (int i = 0; i < genericArguments.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append('[').append(genericArguments.get(i)).append(']');
            }
            sb.append(']');
        }
        for (int i = 0; i < arrayRank; i++) sb.append("[]");
        if (loadUnitName != null) sb.append(", ").append(loadUnitName);
        return sb.toString();
    }
}
