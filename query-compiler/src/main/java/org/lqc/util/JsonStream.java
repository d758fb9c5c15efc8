package org.lqc.util;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.ArrayList;
import java.util.List;

/** Writes JSON text to an {@link IIndentStream}, checking that objects and arrays are balanced. */
public class JsonStream {
    final IIndentStream stream;
    final List<Context> context = new ArrayList<>();

    abstract static class Context implements ICastable {
        int index = 0;
    }

    static class InArray extends Context {}

    static class InObject extends Context {
        boolean expectLabel = true;
    }

    public JsonStream(IIndentStream stream) {
        this.stream = stream;
    }

    void value() {
        if (this.context.isEmpty())
            return;
        Context last = Utilities.last(this.context);
        if (last.is(InArray.class)) {
            if (last.index != 0)
                this.stream.append(",").newline();
            else
                this.stream.increase();
            last.index++;
        } else {
            InObject io = last.to(InObject.class);
            Utilities.enforce(!io.expectLabel, "Missing label");
            io.index++;
            io.expectLabel = true;
        }
    }

    public JsonStream append(String string) {
        this.value();
        try {
            this.stream.append(Utilities.deterministicObjectMapper().writeValueAsString(string));
        } catch (JsonProcessingException ex) {
            throw new RuntimeException(ex);
        }
        return this;
    }

    /** Append the simple class name of the data as the "class" property. */
    public <T> JsonStream appendClass(T data) {
        return this.label("class").append(data.getClass().getSimpleName());
    }

    public JsonStream append(boolean b) {
        this.value();
        this.stream.append(b);
        return this;
    }

    public JsonStream append(long v) {
        this.value();
        this.stream.append(v);
        return this;
    }

    public JsonStream label(String label) {
        Utilities.enforce(!label.isEmpty());
        Context last = Utilities.last(this.context);
        InObject io = last.to(InObject.class, "Adding label but not within JSON object");
        Utilities.enforce(io.expectLabel, "Consecutive labels");
        io.expectLabel = false;
        if (io.index == 0)
            this.stream.increase();
        else
            this.stream.append(",").newline();
        this.stream.appendJsonLabelAndColon(label);
        return this;
    }

    public JsonStream beginArray() {
        this.value();
        this.context.add(new InArray());
        this.stream.append("[");
        return this;
    }

    public JsonStream endArray() {
        Context last = Utilities.removeLast(this.context);
        Utilities.enforce(last.is(InArray.class));
        if (last.index != 0)
            this.stream.newline().decrease();
        this.stream.append("]");
        return this;
    }

    public JsonStream beginObject() {
        this.value();
        this.context.add(new InObject());
        this.stream.append("{");
        return this;
    }

    public JsonStream endObject() {
        Context last = Utilities.removeLast(this.context);
        Utilities.enforce(last.is(InObject.class));
        if (last.index != 0)
            this.stream.newline().decrease();
        this.stream.append("}");
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
