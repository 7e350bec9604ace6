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

/**
 * Decision table program: declared domains and the control statement body.
 * Built once by ProgramBuilder and never changed afterwards.
 */
final class Program {
    static final int NO_DEPTH = -1;

    final String name;
    final int depth;
    private final Domain[] inputs;
    private final Domain[] outputs;
    private final Directive[] body;

    Program(String name, int depth, Domain[] inputs, Domain[] outputs,
            Directive[] body) {
        this.name = name;
        this.depth = depth;
        this.inputs = inputs;
        this.outputs = outputs;
        this.body = body;
    }

    int inputCount() {
        return inputs.length;
    }

    Domain input(int i) {
        return inputs[i];
    }

    int outputCount() {
        return outputs.length;
    }

    Domain output(int i) {
        return outputs[i];
    }

    int size() {
        return body.length;
    }

    Directive statement(int i) {
        return body[i];
    }

    Domain findInput(String name) {
        return find(inputs, name);
    }

    Domain findOutput(String name) {
        return find(outputs, name);
    }

    int outputIndex(String name) {
        for (int i = 0; i < outputs.length; ++i)
            if (outputs[i].name.equals(name))
                return i;
        return -1;
    }

    private static Domain find(Domain[] domains, String name) {
        for (int i = 0; i < domains.length; ++i)
            if (domains[i].name.equals(name))
                return domains[i];
        return null;
    }

    /**
     * Parse tree style dump used by the -parse-tree option.
     */
    String str() {
        StringBuffer buf = new StringBuffer("(`program ");
        buf.append(name);
        if (depth != NO_DEPTH)
            buf.append(" (D ").append(depth).append(')');
        for (int i = 0; i < inputs.length; ++i)
            buf.append("\n  ").append(inputs[i]);
        for (int i = 0; i < outputs.length; ++i)
            buf.append("\n  ").append(outputs[i]);
        for (int i = 0; i < body.length; ++i)
            buf.append("\n  ").append(body[i].str());
        return buf.append(')').toString();
    }
}
