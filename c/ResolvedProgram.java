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

import psuc.compiler.PsuParser.Directive;
import psuc.compiler.PsuParser.Label;

/**
 * Program with its control flow resolved: the active state of every body
 * statement and the fallthrough target of every test.
 */
public final class ResolvedProgram {
    static final int NO_TARGET = -1;

    final Program program;
    private final int[] states;
    private final int[] fallthrough;
    private final int[] guards;

    ResolvedProgram(Program program, int[] states, int[] fallthrough,
                    int[] guards) {
        this.program = program;
        this.states = states;
        this.fallthrough = fallthrough;
        this.guards = guards;
    }

    /** Active state id of the body statement at given position. */
    int state(int i) {
        return states[i];
    }

    /** Fallthrough target of the test at given position, or NO_TARGET. */
    int fallthrough(int i) {
        return fallthrough[i];
    }

    /**
     * Whether only label 0 markers separate the statement from the next
     * non-zero label, so that falling off it enters that label's state.
     */
    boolean endsBlock(int i) {
        for (int n = program.size(); ++i < n;) {
            Directive st = program.statement(i);
            if (!(st instanceof Label))
                return false;
            if (((Label) st).id != 0)
                return true;
        }
        return false;
    }

    /** Distinct active states in the order of their first statement. */
    int[] guards() {
        return (int[]) guards.clone();
    }
}
