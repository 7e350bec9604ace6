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

/*
   Syntax.

Comma form, one directive per line (CSV quoting allowed):
    I,var,val        input value
    O,var,val        output value
    D,n              maximum depth
    L,n              label
    J,n              jump, J,0 returns
    T,var,val,n      test
    R,var,val        assign

Symbol form:
    # E var val      input value
    # R var val      output value
    # D n            maximum depth
    < n              label
    > n              jump
    : var val > n    test
    = var val        assign
*/

package psuc.compiler;

import java.util.ArrayList;
import java.util.List;

interface PsuParser {
    class Directive {
        int line;
        int col;

        Directive pos(int line, int col) {
            this.line = line;
            this.col = col;
            return this;
        }

        String str() {
            return toString();
        }
    }

    final class Label extends Directive {
        final int id;

        Label(int id) {
            this.id = id;
        }

        String str() {
            return "(L " + id + ')';
        }
    }

    final class Test extends Directive {
        final String var;
        final String val;
        final int target;

        Test(String var, String val, int target) {
            this.var = var;
            this.val = val;
            this.target = target;
        }

        String str() {
            return "(T " + var + ' ' + val + ' ' + target + ')';
        }
    }

    final class Jump extends Directive {
        final int target;

        Jump(int target) {
            this.target = target;
        }

        String str() {
            return "(J " + target + ')';
        }
    }

    final class Assign extends Directive {
        final String var;
        final String val;

        Assign(String var, String val) {
            this.var = var;
            this.val = val;
        }

        String str() {
            return "(R " + var + ' ' + val + ')';
        }
    }

    final class Decl extends Directive {
        final int kind;
        final String var;
        final String val;

        Decl(int kind, String var, String val) {
            this.kind = kind;
            this.var = var;
            this.val = val;
        }

        String str() {
            return (kind == Domain.INPUT ? "(I " : "(O ")
                        + var + ' ' + val + ')';
        }
    }

    final class Depth extends Directive {
        final int depth;

        Depth(int depth) {
            this.depth = depth;
        }

        String str() {
            return "(D " + depth + ')';
        }
    }

    final class Parser {
        private static final String SYMBOL_PREFIXES = "#<>:=";

        private char[] src;
        private int p;
        private int line;
        private String text;

        Parser(char[] src) {
            this.src = src;
        }

        /**
         * Reads the whole source and returns the directives in file order.
         * Lines that are blank or not recognised produce nothing.
         */
        List parse() {
            List result = new ArrayList();
            if (p == 0 && src.length != 0 && src[0] == '\uFEFF')
                p = 1; // byte order mark
            while (p < src.length) {
                int start = p;
                while (p < src.length && src[p] != '\n')
                    ++p;
                int end = p;
                if (p < src.length)
                    ++p;
                if (end > start && src[end - 1] == '\r')
                    --end;
                ++line;
                text = new String(src, start, end - start);
                Directive d = readLine();
                if (d != null)
                    result.add(d);
            }
            return result;
        }

        private Directive readLine() {
            int i = 0, len = text.length();
            while (i < len && Character.isWhitespace(text.charAt(i)))
                ++i;
            if (i >= len)
                return null;
            Directive d = SYMBOL_PREFIXES.indexOf(text.charAt(i)) >= 0
                ? readSymbolLine(i) : readCommaLine(i);
            return d == null ? null : d.pos(line, i + 1);
        }

        private Directive readCommaLine(int from) {
            String[] f = splitCsv(text.substring(from));
            String cmd = f[0].trim();
            if (cmd.length() != 1)
                return null;
            switch (cmd.charAt(0)) {
            case 'I':
                need(f, 3, "input");
                return new Decl(Domain.INPUT, f[1], f[2]);
            case 'O':
                need(f, 3, "output");
                return new Decl(Domain.OUTPUT, f[1], f[2]);
            case 'D':
                need(f, 2, "depth");
                return new Depth(number(f[1], from));
            case 'L':
                need(f, 2, "label");
                return new Label(number(f[1], from));
            case 'J':
                need(f, 2, "jump");
                return new Jump(number(f[1], from));
            case 'T':
                need(f, 4, "test");
                return new Test(f[1], f[2], number(f[3], from));
            case 'R':
                need(f, 3, "assign");
                return new Assign(f[1], f[2]);
            }
            return null;
        }

        private Directive readSymbolLine(int from) {
            char c = text.charAt(from);
            String[] t = splitWords(text.substring(from + 1));
            switch (c) {
            case '#':
                if (t.length == 0 || t[0].length() != 1)
                    return null; // plain comment
                switch (t[0].charAt(0)) {
                case 'E':
                    need(t, 3, "input");
                    return new Decl(Domain.INPUT, t[1], t[2]);
                case 'R':
                    need(t, 3, "output");
                    return new Decl(Domain.OUTPUT, t[1], t[2]);
                case 'D':
                    need(t, 2, "depth");
                    return new Depth(number(t[1], from));
                }
                return null;
            case '<':
                need(t, 1, "label");
                return new Label(number(t[0], from));
            case '>':
                need(t, 1, "jump");
                return new Jump(number(t[0], from));
            case ':':
                need(t, 4, "test");
                if (!">".equals(t[2]))
                    throw new CompileException(line, from + 1,
                        "Expected '>' before the test target, not `"
                        + t[2] + "': " + text.trim());
                return new Test(t[0], t[1], number(t[3], from));
            default: // '='
                need(t, 2, "assign");
                return new Assign(t[0], t[1]);
            }
        }

        private void need(String[] fields, int count, String what) {
            if (fields.length < count)
                throw new CompileException(line, 0, "Malformed " + what
                    + " directive (expected " + count + " fields, got "
                    + fields.length + "): " + text.trim());
        }

        private int number(String s, int col) {
            s = s.trim();
            int n;
            try {
                n = Integer.parseInt(s);
            } catch (NumberFormatException ex) {
                n = -1;
            }
            if (n < 0)
                throw new CompileException(line, col + 1,
                    "Expected a non-negative number, not `" + s + "': "
                    + text.trim());
            return n;
        }

        /**
         * Splits one CSV record. A field that starts with a quote runs to
         * the matching quote, doubled quotes inside it stand for one quote.
         */
        static String[] splitCsv(String s) {
            List fields = new ArrayList();
            StringBuffer buf = new StringBuffer();
            boolean quoted = false, atStart = true;
            for (int i = 0, len = s.length(); i < len; ++i) {
                char c = s.charAt(i);
                if (quoted) {
                    if (c != '"') {
                        buf.append(c);
                    } else if (i + 1 < len && s.charAt(i + 1) == '"') {
                        buf.append('"');
                        ++i;
                    } else {
                        quoted = false;
                    }
                } else if (c == ',') {
                    fields.add(buf.toString());
                    buf.setLength(0);
                    atStart = true;
                    continue;
                } else if (c == '"' && atStart) {
                    quoted = true;
                } else {
                    buf.append(c);
                }
                atStart = false;
            }
            fields.add(buf.toString());
            return (String[]) fields.toArray(new String[fields.size()]);
        }

        static String[] splitWords(String s) {
            s = s.trim();
            return s.length() == 0 ? new String[0] : s.split("\\s+");
        }
    }
}
