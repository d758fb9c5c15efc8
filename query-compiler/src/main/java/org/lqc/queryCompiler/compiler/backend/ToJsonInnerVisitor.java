package org.lqc.queryCompiler.compiler.backend;

import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.visitors.VisitDecision;
import org.lqc.queryCompiler.compiler.visitors.inner.InnerVisitor;
import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.queryCompiler.ir.LQMethod;
import org.lqc.queryCompiler.ir.expression.LQBinaryExpression;
import org.lqc.queryCompiler.ir.expression.LQConstantExpression;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.queryCompiler.ir.expression.LQParameterExpression;
import org.lqc.queryCompiler.ir.type.derived.LQTypeStruct;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.lqc.util.IndentStream;
import org.lqc.util.JsonStream;

import java.util.HashSet;
import java.util.Set;

/** Serializes an IR node as a JSON string.
 * Since this visitor calls the visit methods for InnerVisitor, it should generally
 * only handle fields which are not visited by InnerVisitor, i.e., the ones which are not LQNode objects. */
public class ToJsonInnerVisitor extends InnerVisitor {
    public final JsonStream stream;
    /** When positive every expression also carries its text form. */
    final int verbosity;
    final Set<Long> serialized;

    public ToJsonInnerVisitor(QueryCompiler compiler, JsonStream stream, int verbosity) {
        super(compiler);
        this.stream = stream;
        this.verbosity = verbosity;
        this.serialized = new HashSet<>();
    }

    /** Serialize a node into a JSON string. */
    public static String toJsonString(QueryCompiler compiler, ILQNode node, int verbosity) {
        JsonStream stream = new JsonStream(IndentStream.inMemory());
        ToJsonInnerVisitor visitor = new ToJsonInnerVisitor(compiler, stream, verbosity);
        visitor.apply(node);
        return stream.toString();
    }

    boolean checkDone(ILQNode node, boolean silent) {
        if (this.serialized.contains(node.getId())) {
            if (silent)
                return true;
            this.stream.beginObject()
                    .label("node")
                    .append(node.getId())
                    .endObject();
            return true;
        }
        return false;
    }

    @Override
    public void startArrayProperty(String property) {
        this.stream.label(property).beginArray();
    }

    @Override
    public void endArrayProperty(String property) {
        this.stream.endArray();
    }

    @Override
    public void property(String name) {
        this.stream.label(name);
    }

    @Override
    public void push(ILQNode node) {
        if (!this.checkDone(node, true)) {
            this.stream.appendClass(node);
            this.property("id");
            this.stream.append(node.getId());
            this.serialized.add(node.getId());
        }
        super.push(node);
    }

    @Override
    public VisitDecision preorder(ILQNode node) {
        if (this.checkDone(node, false))
            return VisitDecision.STOP;
        this.stream.beginObject();
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(ILQNode node) {
        this.stream.endObject();
    }

    @Override
    public void postorder(LQExpression node) {
        if (this.verbosity > 0) {
            this.property("text");
            this.stream.append(node.toString());
        }
        super.postorder(node);
    }

    @Override
    public void postorder(LQTypeBaseType node) {
        this.property("code");
        this.stream.append(node.code.name());
        this.property("mayBeNull");
        this.stream.append(node.mayBeNull);
        super.postorder(node);
    }

    @Override
    public void postorder(LQTypeStruct node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }

    @Override
    public void postorder(LQTypeStruct.Field node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }

    @Override
    public void postorder(LQMember node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }

    @Override
    public void postorder(LQMethod node) {
        this.property("declaringClass");
        this.stream.append(node.declaringClass);
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }

    @Override
    public void postorder(LQConstantExpression node) {
        String value = node.valueAsString();
        if (value != null) {
            this.property("value");
            this.stream.append(value);
        }
        super.postorder(node);
    }

    @Override
    public void postorder(LQParameterExpression node) {
        this.property("name");
        this.stream.append(node.name);
        super.postorder(node);
    }

    @Override
    public void postorder(LQBinaryExpression node) {
        this.property("opcode");
        this.stream.append(node.opcode.name());
        super.postorder(node);
    }
}
