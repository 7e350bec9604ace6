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
import java.util.Arrays;
import java.util.List;

/**
 * Named enumerated variable of a decision table.
 */
final class Domain {
    static final int INPUT  = 0;
    static final int OUTPUT = 1;

    final String name;
    final int kind;
    private final List values = new ArrayList();

    Domain(String name, int kind) {
        this.name = name;
        this.kind = kind;
    }

    // false when the value was already declared
    boolean add(String value) {
        if (values.contains(value))
            return false;
        values.add(value);
        return true;
    }

    boolean contains(String value) {
        return values.contains(value);
    }

    /** Values in declaration order. */
    String[] values() {
        return (String[]) values.toArray(new String[values.size()]);
    }

    /** Values in the order of their generated codes. */
    String[] sortedValues() {
        String[] r = values();
        Arrays.sort(r);
        return r;
    }

    String kindName() {
        return kind == INPUT ? "input" : "output";
    }

    public String toString() {
        return kindName() + ' ' + name + values;
    }
}
