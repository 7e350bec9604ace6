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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import psuc.compiler.PsuParser.Assign;
import psuc.compiler.PsuParser.Directive;
import psuc.compiler.PsuParser.Jump;
import psuc.compiler.PsuParser.Label;
import psuc.compiler.PsuParser.Test;

/**
 * Runs a resolved decision table without generating code, following
 * the same dispatch rules as the generated evaluate method.
 *
 * <pre>
 * ResolvedProgram table = new Compiler().resolve("lamp", source);
 * String[] out = new Evaluator(table).evaluate(new String[] { "on" });
 * </pre>
 */
public class Evaluator {
    private final static Logger LOG =
        Logger.getLogger(Evaluator.class.getName());
    public static final int DEFAULT_MAX_STEPS = 100000;

    private final ResolvedProgram rp;
    private final Program program;
    private final Map blocks = new HashMap();
    private int maxSteps = DEFAULT_MAX_STEPS;

    public Evaluator(ResolvedProgram rp) {
        this.rp = rp;
        this.program = rp.program;
        int[] guards = rp.guards();
        for (int i = 0; i < guards.length; ++i) {
            List block = new ArrayList();
            for (int j = 0; j < program.size(); ++j)
                if (rp.state(j) == guards[i])
                    block.add(Integer.valueOf(j));
            blocks.put(Integer.valueOf(guards[i]), block);
        }
    }

    /**
     * Limits the number of state transitions of one evaluation.
     */
    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    /**
     * Evaluates the table.
     *
     * @param inputs one value name per input variable, in declaration order
     * @return one value name per output variable, in declaration order,
     *         null where no value was assigned
     * @throws IllegalArgumentException on unknown input values
     * @throws IllegalStateException when the table gets stuck
     */
    public String[] evaluate(String[] inputs) {
        if (inputs.length != program.inputCount())
            throw new IllegalArgumentException("Expected "
                + program.inputCount() + " inputs, got " + inputs.length);
        for (int i = 0; i < inputs.length; ++i)
            if (!program.input(i).contains(inputs[i]))
                throw new IllegalArgumentException("Value " + inputs[i]
                    + " is not declared for input " + program.input(i).name);
        String[] outputs = new String[program.outputCount()];
        int state = 0;
    dispatch:
        for (int steps = 0; steps < maxSteps; ++steps) {
            List block = (List) blocks.get(Integer.valueOf(state));
            for (int k = 0, cnt = block == null ? 0 : block.size();
                 k < cnt; ++k) {
                int i = ((Integer) block.get(k)).intValue();
                Directive st = program.statement(i);
                if (st instanceof Label) {
                    if (((Label) st).id != 0) {
                        state = ((Label) st).id;
                        continue dispatch;
                    }
                } else if (st instanceof Test) {
                    Test t = (Test) st;
                    if (t.val.equals(input(inputs, t.var))) {
                        state = t.target;
                        continue dispatch;
                    }
                    int ft = rp.fallthrough(i);
                    if (ft != ResolvedProgram.NO_TARGET && rp.endsBlock(i)) {
                        state = ft;
                        continue dispatch;
                    }
                } else if (st instanceof Jump) {
                    if (((Jump) st).target == 0)
                        return outputs;
                    state = ((Jump) st).target;
                    continue dispatch;
                } else if (st instanceof Assign) {
                    Assign a = (Assign) st;
                    outputs[program.outputIndex(a.var)] = a.val;
                }
            }
            throw new IllegalStateException("No transition from state "
                                            + state);
        }
        LOG.warning(program.name + ": gave up after " + maxSteps
                    + " transitions");
        throw new IllegalStateException("No result after " + maxSteps
            + " transitions, last state " + state);
    }

    private String input(String[] inputs, String var) {
        for (int i = 0; i < inputs.length; ++i)
            if (program.input(i).name.equals(var))
                return inputs[i];
        throw new IllegalStateException("Unknown input variable " + var);
    }
}
