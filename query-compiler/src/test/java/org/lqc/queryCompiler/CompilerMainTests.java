package org.lqc.queryCompiler;

import com.fasterxml.jackson.databind.JsonNode;
import org.lqc.queryCompiler.compiler.backend.JsonDecoder;
import org.lqc.queryCompiler.compiler.errors.CompilerMessages;
import org.lqc.queryCompiler.compiler.visitors.inner.ReplacingExpressionVisitor;
import org.lqc.queryCompiler.ir.expression.LQExpression;
import org.lqc.util.Logger;
import org.lqc.util.Utilities;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.net.URISyntaxException;
import java.net.URL;

/** Tests for the command-line entry point. */
public class CompilerMainTests {
    String resource(String name) throws URISyntaxException {
        URL url = this.getClass().getResource("/" + name);
        Assert.assertNotNull("Missing resource " + name, url);
        return new File(url.toURI()).getPath();
    }

    static File outputFile() throws IOException {
        File file = File.createTempFile("out", ".txt");
        file.deleteOnExit();
        return file;
    }

    /** Run the compiler on a resource and return its output. */
    String rewrite(String resource, String... options) throws IOException, URISyntaxException {
        File output = outputFile();
        String[] argv = new String[options.length + 3];
        System.arraycopy(options, 0, argv, 0, options.length);
        argv[options.length] = "-o";
        argv[options.length + 1] = output.getPath();
        argv[options.length + 2] = this.resource(resource);
        CompilerMessages messages = CompilerMain.execute(argv);
        if (messages.errorCount() > 0)
            throw new RuntimeException(messages.toString());
        Assert.assertEquals(0, messages.exitCode);
        return Utilities.readFile(output.toPath()).trim();
    }

    /** Run the compiler and return the messages, discarding stderr. */
    static CompilerMessages quietly(String... argv) {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        PrintStream old = System.err;
        System.setErr(new PrintStream(os));
        try {
            return CompilerMain.execute(argv);
        } finally {
            System.setErr(old);
        }
    }

    @Test
    public void testMemberInit() throws IOException, URISyntaxException {
        Assert.assertEquals("5", this.rewrite("member-init.json"));
    }

    @Test
    public void testConditional() throws IOException, URISyntaxException {
        Assert.assertEquals("Convert((c ? Convert(new Dto { Prop = 5 }.Prop, int?) : null), int)",
                this.rewrite("conditional.json"));
    }

    @Test
    public void testConditionalDisabled() throws IOException, URISyntaxException {
        Assert.assertEquals("(c ? new Dto { Prop = 5 } : null).Prop",
                this.rewrite("conditional.json", "--noConditionalMemberPushdown"));
    }

    @Test
    public void testInline() throws IOException, URISyntaxException {
        Assert.assertEquals("5", this.rewrite("lambda.json", "--inline"));
        Assert.assertEquals("Invoke((x) => x.Prop, new Dto { Prop = 5 })", this.rewrite("lambda.json"));
    }

    @Test
    public void testJsonOutput() throws IOException, URISyntaxException {
        String json = this.rewrite("member-init.json", "--json");
        JsonNode node = Utilities.deterministicObjectMapper().readTree(json);
        LQExpression result = new JsonDecoder().decodeInner(node, LQExpression.class);
        Assert.assertEquals("5", result.toString());
    }

    @Test
    public void testLengthMismatch() throws URISyntaxException {
        CompilerMessages messages = quietly(this.resource("mismatch.json"));
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
        Assert.assertTrue(messages.toString().contains("1 originals but 0 replacements"));
    }

    @Test
    public void testUnknownClass() throws URISyntaxException {
        CompilerMessages messages = quietly(this.resource("unknown-class.json"));
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("LQTernaryExpression"));
    }

    @Test
    public void testMalformedInput() throws IOException {
        File file = File.createTempFile("input", ".json");
        file.deleteOnExit();
        try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
            writer.println("{ \"tree\": ");
        }
        CompilerMessages messages = quietly(file.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("Error parsing input"));
    }

    @Test
    public void testNotAnObject() throws IOException {
        File file = File.createTempFile("input", ".json");
        file.deleteOnExit();
        try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
            writer.println("[]");
        }
        CompilerMessages messages = quietly(file.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("must be a JSON object"));
    }

    static CompilerMessages runRequest(String request) throws IOException {
        File file = File.createTempFile("input", ".json");
        file.deleteOnExit();
        try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
            writer.println(request);
        }
        return quietly(file.getPath());
    }

    @Test
    public void testMissingRequestProperties() throws IOException {
        String tree = "\"tree\": { \"class\": \"LQConstantExpression\", \"value\": \"3\"," +
                " \"type\": { \"class\": \"LQTypeBaseType\", \"code\": \"INT64\", \"mayBeNull\": false } }";
        CompilerMessages messages = runRequest("{ \"originals\": [], \"replacements\": [] }");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
        Assert.assertTrue(messages.toString().contains("Compilation error"));
        Assert.assertTrue(messages.toString().contains("Rewrite request has no 'tree'"));

        messages = runRequest("{ " + tree + ", \"replacements\": [] }");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("Rewrite request has no 'originals'"));

        messages = runRequest("{ " + tree + ", \"originals\": {}, \"replacements\": [] }");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("Compilation error"));
        Assert.assertTrue(messages.toString().contains("'originals' must be an array"));

        messages = runRequest("{ " + tree + ", \"originals\": [], \"replacements\": 2 }");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("'replacements' must be an array"));
    }

    @Test
    public void testNothingToReplace() throws IOException {
        File file = File.createTempFile("input", ".json");
        file.deleteOnExit();
        try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
            writer.println("{ \"tree\": { \"class\": \"LQConstantExpression\", \"value\": \"3\"," +
                    " \"type\": { \"class\": \"LQTypeBaseType\", \"code\": \"INT64\", \"mayBeNull\": false } }," +
                    " \"originals\": [], \"replacements\": [] }");
        }
        File output = outputFile();
        CompilerMessages messages = CompilerMain.execute("-o", output.getPath(), file.getPath());
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertEquals(0, messages.errorCount());
        Assert.assertTrue(messages.toString().contains("warning: Empty request"));
        Assert.assertEquals("3", Utilities.readFile(output.toPath()).trim());

        messages = CompilerMain.execute("-q", "-o", output.getPath(), file.getPath());
        Assert.assertEquals("", messages.toString());
    }

    @Test
    public void testMissingFile() {
        CompilerMessages messages = quietly("/no/such/file.json");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("Error reading file"));
    }

    @Test
    public void testHelp() {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        PrintStream old = System.out;
        System.setOut(new PrintStream(os));
        CompilerMessages messages;
        try {
            messages = CompilerMain.execute("-h");
        } finally {
            System.setOut(old);
        }
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(0, messages.errorCount());
    }

    @Test
    public void testBadLoggingParameter() throws URISyntaxException {
        CompilerMessages messages = quietly("-TReplacingExpressionVisitor=x", this.resource("member-init.json"));
        Assert.assertEquals(1, messages.exitCode);
        messages = quietly("-TNoSuchVisitor=1", this.resource("member-init.json"));
        Assert.assertEquals(1, messages.exitCode);
    }

    // Test the -T command-line parameter
    @Test
    public void testLoggingParameter() throws IOException, URISyntaxException {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        try {
            Assert.assertEquals("5", this.rewrite("member-init.json", "-TReplacingExpressionVisitor=2"));
        } finally {
            Logger.INSTANCE.setDebugStream(save);
            Logger.INSTANCE.setLoggingLevel(ReplacingExpressionVisitor.class, 0);
        }
        Assert.assertTrue(builder.toString().contains("Replacing d with new Dto { Prop = 5 }"));
    }
}
