// ex: se sts=4 sw=4 expandtab:

/*
 * psuc decision table pseudocode compiler.
 *
 * Copyright (c) 2007-2013 Madis Janson
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions
 * are met:
 * 1. Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 * 3. The name of the author may not be used to endorse or promote products
 *    derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE AUTHOR "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES
 * OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED.
 * IN NO EVENT SHALL THE AUTHOR BE LIABLE FOR ANY DIRECT, INDIRECT,
 * INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT
 * NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF
 * THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package psuc.compiler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import psuc.compiler.PsuParser.Assign;
import psuc.compiler.PsuParser.Directive;
import psuc.compiler.PsuParser.Jump;
import psuc.compiler.PsuParser.Label;
import psuc.compiler.PsuParser.Test;

/**
 * Computes active states and test fallthrough targets.
 *
 * <p>A statement belongs to the state opened by the nearest non-zero label
 * before it, or to the initial state 0. Label 0 is only a marker: it does
 * not open a state and is skipped when looking ahead for the fallthrough
 * label of a test.
 */
final class Resolver {
    private final Program program;
    private final List warnings;

    Resolver(Program program, List warnings) {
        this.program = program;
        this.warnings = warnings;
    }

    ResolvedProgram resolve(boolean validate) {
        int n = program.size();
        int[] states = new int[n];
        int[] fallthrough = new int[n];
        List guards = new ArrayList();
        Set labels = new HashSet();
        int state = 0;

        for (int i = 0; i < n; ++i) {
            Directive st = program.statement(i);
            states[i] = state;
            fallthrough[i] = ResolvedProgram.NO_TARGET;
            Integer id = Integer.valueOf(state);
            if (!guards.contains(id))
                guards.add(id);
            if (st instanceof Label && ((Label) st).id != 0) {
                state = ((Label) st).id;
                if (!labels.add(Integer.valueOf(state)))
                    warnings.add(new CompileException(st.line, st.col,
                        "Duplicate label " + state + ", its statements "
                        + "join the block of the first one"));
            } else if (st instanceof Test) {
                fallthrough[i] = nextLabel(i + 1);
            }
        }

        if (validate) {
            checkDomains();
            for (int i = 0; i < n; ++i)
                check(program.statement(i), labels);
        }

        int[] order = new int[guards.size()];
        for (int i = 0; i < order.length; ++i)
            order[i] = ((Integer) guards.get(i)).intValue();
        return new ResolvedProgram(program, states, fallthrough, order);
    }

    // first non-zero label at or after the given position
    private int nextLabel(int from) {
        for (int i = from, n = program.size(); i < n; ++i) {
            Directive st = program.statement(i);
            if (st instanceof Label && ((Label) st).id != 0)
                return ((Label) st).id;
        }
        return ResolvedProgram.NO_TARGET;
    }

    private void checkDomains() {
        for (int i = 0; i < program.inputCount(); ++i) {
            String name = program.input(i).name;
            if (program.findOutput(name) != null)
                throw new CompileException(0, 0, "Variable " + name
                            + " is declared both as input and output");
        }
    }

    private void check(Directive st, Set labels) {
        int target = -1;
        if (st instanceof Test) {
            Test t = (Test) st;
            checkValue(st, program.findInput(t.var), t.var, t.val, "input");
            target = t.target;
        } else if (st instanceof Jump) {
            target = ((Jump) st).target;
        } else if (st instanceof Assign) {
            Assign a = (Assign) st;
            checkValue(st, program.findOutput(a.var), a.var, a.val, "output");
        }
        if (target > 0 && !labels.contains(Integer.valueOf(target)))
            throw new CompileException(st.line, st.col,
                "Unreachable target " + target + " in " + st.str()
                + ": no label " + target + " in the program");
    }

    private static void checkValue(Directive st, Domain domain,
                                   String var, String val, String kind) {
        if (domain == null)
            throw new CompileException(st.line, st.col,
                "Unknown " + kind + " variable " + var + " in " + st.str());
        if (!domain.contains(val))
            throw new CompileException(st.line, st.col,
                "Value " + val + " is not declared for " + kind + ' '
                + var + " in " + st.str());
    }
}
