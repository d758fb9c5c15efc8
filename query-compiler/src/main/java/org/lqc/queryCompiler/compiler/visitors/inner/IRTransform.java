package org.lqc.queryCompiler.compiler.visitors.inner;

import org.lqc.queryCompiler.ir.ILQNode;
import org.lqc.util.ICastable;

import java.util.function.Function;

/** A transformation of IR trees. */
public interface IRTransform extends Function<ILQNode, ILQNode>, ICastable {}
