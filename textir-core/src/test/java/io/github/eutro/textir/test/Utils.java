package io.github.eutro.textir.test;

import io.github.eutro.textir.ssa.*;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.textir.ssa.Expr.*;
import static io.github.eutro.textir.ssa.IRBuilder.param;
import static io.github.eutro.textir.ssa.Terminator.*;

public class Utils {
    @NotNull
    public static List<String> lines(Block block) {
        List<String> lines = new ArrayList<>();
        lines.add(block.headerString());
        for (Insn insn : block.getInsns()) {
            lines.add(insn.toString());
        }
        lines.add(block.getTerminator().toString());
        return lines;
    }

    @NotNull
    public static List<String> lines(Procedure proc) {
        List<String> lines = new ArrayList<>();
        for (Block block : proc.getBlocks()) {
            lines.addAll(lines(block));
        }
        return lines;
    }

    public static BoolExpr atom(int index) {
        return BoolExpr.atom(var(index));
    }

    /**
     * The CFG of {@code def f(x, y, z, t): return (x and y) or (z and t)}.
     */
    public static Procedure pythonInspired() {
        return new IRBuilder("f", Typ.INT)
                .formal("x", Typ.INT).formal("y", Typ.INT).formal("z", Typ.INT).formal("t", Typ.INT)
                .block("b0")
                .load(0, Typ.INT, "x")
                .insertTerminator(ifThenElse(atom(0), jumpTo("b1"), jumpTo("b2")))
                .block("b1")
                .load(2, Typ.INT, "y")
                .insertTerminator(ifThenElse(atom(2), jump(NodeCall.of("b4", var(2))), jumpTo("b2")))
                .block("b2")
                .load(5, Typ.INT, "z")
                .insertTerminator(ifThenElse(atom(5), jumpTo("b5"), jump(NodeCall.of("b4", var(5)))))
                .block("b5")
                .load(8, Typ.INT, "t")
                .insertTerminator(jump(NodeCall.of("b4", var(8))))
                .block("b4", param(9, Typ.INT))
                .insertTerminator(ret(var(9)))
                .build();
    }
}
