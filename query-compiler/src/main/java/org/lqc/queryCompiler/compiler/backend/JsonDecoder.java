package org.lqc.queryCompiler.compiler.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lqc.queryCompiler.compiler.errors.CompilationError;
import org.lqc.queryCompiler.compiler.errors.InternalCompilerError;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.type.derived.LQTypeStruct;
import org.lqc.util.Utilities;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Deserialize data serialized by {@link ToJsonInnerVisitor}.
 * Nodes without an "id" property are accepted, but cannot be referenced. */
public class JsonDecoder {
    final Map<Long, ILQNode> decoded;

    public JsonDecoder() {
        this.decoded = new HashMap<>();
    }

    static final String ROOT = "org.lqc.queryCompiler.ir";
    static final List<String> PACKAGES = Arrays.asList(
            "", "expression", "type.primitive", "type.derived");

    static Class<?> getClass(String simpleName) {
        if (simpleName.equals("Field"))
            // Special cases for inner classes
            return LQTypeStruct.Field.class;
        for (String pack : PACKAGES) {
            String className = ROOT;
            if (!pack.isEmpty())
                className += "." + pack;
            className += "." + simpleName;
            try {
                return Class.forName(className);
            } catch (ClassNotFoundException ignored) {
                // try the next package
            }
        }
        throw new CompilationError("Class " + Utilities.singleQuote(simpleName) + " not found");
    }

    ILQNode lookup(long id) {
        ILQNode result = this.decoded.get(id);
        if (result == null)
            throw new CompilationError("Could not find node with id " + id);
        return result;
    }

    ILQNode decode(JsonNode node) {
        if (!node.isObject())
            throw new CompilationError("Expected a JSON object, got " + Utilities.toDepth(node, 1));
        ObjectNode object = (ObjectNode) node;
        JsonNode nodeProp = object.get("node");
        if (nodeProp != null)
            return this.lookup(nodeProp.asLong());
        JsonNode cls = object.get("class");
        if (cls == null)
            throw new CompilationError("Node does not have 'class' field: " + Utilities.toDepth(node, 1));
        Class<?> clazz = getClass(cls.asText());
        try {
            Method method = clazz.getMethod("fromJson", JsonNode.class, JsonDecoder.class);
            boolean isStatic = Modifier.isStatic(method.getModifiers());
            if (!isStatic)
                throw new InternalCompilerError(cls.asText() + ".fromJson is not static");
            ILQNode result = (ILQNode) method.invoke(null, node, this);
            if (object.has("id"))
                Utilities.putNew(this.decoded, Utilities.getLongProperty(node, "id"), result);
            return result;
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException)
                throw (RuntimeException) e.getCause();
            throw new InternalCompilerError("Error decoding " + cls.asText(), e);
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new InternalCompilerError("Cannot decode " + cls.asText(), e);
        }
    }

    public <T extends ILQNode> T decodeInner(JsonNode node, Class<T> clazz) {
        ILQNode result = this.decode(node);
        return result.to(clazz, "Expected " + clazz.getSimpleName() + ", got " + result);
    }
}
