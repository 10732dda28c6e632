package io.github.eutro.textir.passes.misc;

import io.github.eutro.textir.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     */
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    /**
     * Flatten nested chains into the list of passes they run, in order.
     *
     * @return The passes.
     */
    @SuppressWarnings("unchecked")
    public List<IRPass<Object, Object>> listPasses() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> cPass = (ChainedPass<?, ?, ?>) pass;
            // a.then(b.then(c)) nests on the right
            if (cPass.nextPass instanceof ChainedPass) {
                List<IRPass<Object, Object>> inner = ((ChainedPass<?, ?, ?>) cPass.nextPass).listPasses();
                for (int i = inner.size() - 1; i >= 0; i--) {
                    passes.add(inner.get(i));
                }
            } else {
                passes.add(cPass.nextPass);
            }
            pass = cPass.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return (List<IRPass<Object, Object>>) (Object) passes;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<Object, Object>> passes = listPasses();
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("running pass " + i + " in chain (" + pass + ")"));
                throw e;
            }
        }
        return (C) acc;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (IRPass<Object, Object> pass : listPasses()) {
            if (sb.length() != 0) sb.append(" -> ");
            sb.append(pass);
        }
        return sb.toString();
    }
}
