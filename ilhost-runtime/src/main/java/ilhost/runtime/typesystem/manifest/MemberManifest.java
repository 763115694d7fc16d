package ilhost.runtime.typesystem.manifest;

import com.google.gson.annotations.SerializedName;
import com.google.gson.JsonElement;

import java.util.ArrayList;
import java.util.List;

/**
 * 字段、常量、方法或属性的清单条目。
 */
public final class MemberManifest {

    private String name;
    private String type;
    private String returnType;
    private List<String> parameters = new ArrayList<>();
    private List<String> genericParameters = new ArrayList<>();
    @SerializedName("static")
    private boolean isStatic;
    @SerializedName("public")
    private Boolean isPublic;
    private JsonElement value;

    public String getName() { return name; }

    /** 字段、常量与属性的类型 */
    public String getType() { return type; }

    /** 方法返回类型，null 表示 void */
    public String getReturnType() { return returnType; }

    public List<String> getParameters() { return parameters == null ? new ArrayList<String>() : parameters; }
    public List<String> getGenericParameters() {
        return genericParameters == null ? new ArrayList<String>() : genericParameters;
    }
    public boolean isStatic() { return isStatic; }
    public boolean isPublic() { return isPublic == null || isPublic; }

    /** 常量值或字段默认值 */
    public JsonElement getValue() { return value; }
}
