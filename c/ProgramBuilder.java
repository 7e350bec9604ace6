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
import java.util.LinkedHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import psuc.compiler.PsuParser.Decl;
import psuc.compiler.PsuParser.Depth;
import psuc.compiler.PsuParser.Directive;

/**
 * Folds a directive stream into a Program. One builder serves exactly
 * one translation.
 */
final class ProgramBuilder {
    private final String name;
    private final Map inputs = new LinkedHashMap();
    private final Map outputs = new LinkedHashMap();
    private final List body = new ArrayList();
    private int depth = Program.NO_DEPTH;
    private boolean built;

    ProgramBuilder(String name) {
        this.name = name;
    }

    ProgramBuilder add(Directive d) {
        if (built)
            throw new IllegalStateException("Program " + name
                                            + " is already built");
        if (d instanceof Decl) {
            Decl decl = (Decl) d;
            Map domains = decl.kind == Domain.INPUT ? inputs : outputs;
            Domain domain = (Domain) domains.get(decl.var);
            if (domain == null) {
                domain = new Domain(decl.var, decl.kind);
                domains.put(decl.var, domain);
            }
            domain.add(decl.val);
        } else if (d instanceof Depth) {
            depth = ((Depth) d).depth;
        } else {
            body.add(d);
        }
        return this;
    }

    ProgramBuilder addAll(List directives) {
        for (int i = 0, cnt = directives.size(); i < cnt; ++i)
            add((Directive) directives.get(i));
        return this;
    }

    Program build() {
        built = true;
        return new Program(name, depth, copy(inputs), copy(outputs),
            (Directive[]) body.toArray(new Directive[body.size()]));
    }

    private static Domain[] copy(Map domains) {
        Domain[] r = new Domain[domains.size()];
        int n = 0;
        for (Iterator i = domains.values().iterator(); i.hasNext(); ++n) {
            Domain d = (Domain) i.next();
            String[] values = d.values();
            r[n] = new Domain(d.name, d.kind);
            for (int j = 0; j < values.length; ++j)
                r[n].add(values[j]);
        }
        return r;
    }
}
