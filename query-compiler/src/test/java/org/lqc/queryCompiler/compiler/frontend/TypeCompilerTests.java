package org.lqc.queryCompiler.compiler.frontend;

import org.lqc.queryCompiler.compiler.CompilerOptions;
import org.lqc.queryCompiler.compiler.QueryCompiler;
import org.lqc.queryCompiler.compiler.errors.CompilationError;
import org.lqc.queryCompiler.compiler.errors.UnimplementedException;
import org.lqc.queryCompiler.ir.LQMember;
import org.lqc.queryCompiler.ir.type.LQType;
import org.lqc.queryCompiler.ir.type.LQTypeCode;
import org.lqc.queryCompiler.ir.type.derived.LQTypeStruct;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeAny;
import org.lqc.queryCompiler.ir.type.primitive.LQTypeBaseType;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public class TypeCompilerTests {
    record Address(String city, int zip) {}

    record Order(int id, Integer quantity, String customer, BigDecimal price,
                 LocalDate placed, LocalDateTime shipped, Address address, Object tag) {}

    record Chain(int value, Chain next) {}

    record Letter(char c) {}

    @SuppressWarnings("unused")
    static class Customer {
        static int count;
        long id;
        Double balance;
    }

    TypeCompiler typeCompiler() {
        return new TypeCompiler(new QueryCompiler(new CompilerOptions()));
    }

    @Test
    public void testRecord() {
        LQTypeStruct order = this.typeCompiler().convertClass(Order.class);
        Assert.assertEquals("Order", order.name);
        Assert.assertEquals(8, order.getFields().size());
        Assert.assertSame(LQTypeBaseType.INT32, order.getField("id").type);
        LQType quantity = order.getField("quantity").type;
        Assert.assertEquals(LQTypeCode.INT32, quantity.code);
        Assert.assertTrue(quantity.mayBeNull);
        Assert.assertSame(LQTypeBaseType.STRING, order.getField("customer").type);
        Assert.assertEquals(LQTypeCode.DECIMAL, order.getField("price").type.code);
        Assert.assertEquals(LQTypeCode.DATE, order.getField("placed").type.code);
        Assert.assertEquals(LQTypeCode.TIMESTAMP, order.getField("shipped").type.code);
        Assert.assertSame(LQTypeAny.INSTANCE, order.getField("tag").type);

        LQType address = order.getField("address").type;
        Assert.assertTrue(address.is(LQTypeStruct.class));
        LQTypeStruct struct = address.to(LQTypeStruct.class);
        Assert.assertEquals("Address", struct.name);
        Assert.assertEquals("city", struct.getFields().get(0).name);
        Assert.assertEquals("zip", struct.getFields().get(1).name);
    }

    @Test
    public void testClass() {
        LQTypeStruct customer = this.typeCompiler().convertClass(Customer.class);
        Assert.assertEquals(2, customer.getFields().size());
        Assert.assertNull(customer.getField("count"));
        Assert.assertSame(LQTypeBaseType.INT64, customer.getField("id").type);
        LQType balance = customer.getField("balance").type;
        Assert.assertEquals(LQTypeCode.DOUBLE, balance.code);
        Assert.assertTrue(balance.mayBeNull);
    }

    @Test
    public void testSameStruct() {
        TypeCompiler compiler = this.typeCompiler();
        LQTypeStruct order = compiler.convertClass(Order.class);
        Assert.assertSame(order, compiler.convertClass(Order.class));
        Assert.assertSame(order.getField("address").type, compiler.convertClass(Address.class));
    }

    @Test
    public void testMember() {
        TypeCompiler compiler = this.typeCompiler();
        LQMember zip = compiler.member(Address.class, "zip");
        Assert.assertEquals("zip", zip.getName());
        Assert.assertSame(LQTypeBaseType.INT32, zip.type);
        Assert.assertEquals(zip, compiler.member(Address.class, "zip"));
        Assert.assertThrows(CompilationError.class, () -> compiler.member(Address.class, "street"));
    }

    @Test
    public void testUnsupported() {
        TypeCompiler compiler = this.typeCompiler();
        Assert.assertThrows(UnimplementedException.class, () -> compiler.convertClass(Chain.class));
        Assert.assertThrows(UnimplementedException.class, () -> compiler.convertClass(Letter.class));
        Assert.assertThrows(UnimplementedException.class, () -> compiler.convertType(int[].class));
        Assert.assertThrows(UnimplementedException.class, () -> compiler.convertType(Runnable.class));
        Assert.assertThrows(UnimplementedException.class, () -> compiler.convertType(LQTypeCode.class));
        // A failed conversion does not prevent later ones
        Assert.assertNotNull(compiler.convertClass(Address.class));
    }
}
