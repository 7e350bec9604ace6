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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import psuc.compiler.PsuParser.Assign;
import psuc.compiler.PsuParser.Directive;
import psuc.compiler.PsuParser.Jump;
import psuc.compiler.PsuParser.Label;
import psuc.compiler.PsuParser.Test;

/**
 * Generates the Java evaluator class for a resolved program.
 *
 * <p>Labeled blocks become guards of a dispatch loop driven by the state
 * register {@code state$}: every transfer of control stores the target state
 * and restarts the loop, {@code J,0} returns the output slots.
 */
final class JavaEmitter {
    static final String STATE = "state$";
    static final String UNSET = "null";

    // reserved words and names the generated code itself refers to
    private static final String[] RESERVED = {
        "abstract", "assert", "boolean", "break", "byte", "case", "catch",
        "char", "class", "const", "continue", "default", "do", "double",
        "else", "enum", "extends", "false", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int",
        "interface", "long", "native", "new", "null", "package", "permits",
        "private", "protected", "public", "record", "return", "sealed",
        "short", "static", "strictfp", "super", "switch", "synchronized",
        "this", "throw", "throws", "transient", "true", "try", "var",
        "void", "volatile", "while", "yield", "_",
        "Enum", "IllegalStateException", "java"
    };

    private final ResolvedProgram rp;
    private final Program program;
    private final String packageName;
    private final List warnings;
    private final StringBuffer out = new StringBuffer();
    final String className;

    JavaEmitter(ResolvedProgram rp, String packageName, List warnings) {
        this.rp = rp;
        this.program = rp.program;
        this.packageName = packageName;
        this.warnings = warnings;
        this.className = className(program);
    }

    /**
     * Java identifier for a table name: characters that can't appear in
     * an identifier become underscores, a leading digit gets an underscore
     * prefix and reserved words an underscore suffix.
     */
    static String ident(String s) {
        StringBuffer r = new StringBuffer(s.length() + 1);
        for (int i = 0; i < s.length(); ++i) {
            char c = s.charAt(i);
            r.append(c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' ||
                     c >= '0' && c <= '9' || c == '_' ? c : '_');
        }
        if (r.length() == 0 || r.charAt(0) >= '0' && r.charAt(0) <= '9')
            r.insert(0, '_');
        String id = r.toString();
        for (int i = 0; i < RESERVED.length; ++i)
            if (RESERVED[i].equals(id))
                return id + '_';
        return id;
    }

    private static String className(Program program) {
        String name = ident(program.name);
        while (isDomain(program, name))
            name += "Table";
        return name;
    }

    private static boolean isDomain(Program program, String id) {
        for (int i = 0; i < program.inputCount(); ++i)
            if (ident(program.input(i).name).equals(id))
                return true;
        for (int i = 0; i < program.outputCount(); ++i)
            if (ident(program.output(i).name).equals(id))
                return true;
        return false;
    }

    String emit() {
        checkIdentifiers();
        out.setLength(0);
        line(0, "// Generated from " + comment(program.name)
                + ".dtc - do not edit");
        if (packageName != null && packageName.length() != 0) {
            line(0, "");
            line(0, "package " + packageName + ';');
        }
        line(0, "");
        line(0, "public final class " + className + " {");
        for (int i = 0; i < program.inputCount(); ++i)
            genEnum(program.input(i));
        for (int i = 0; i < program.outputCount(); ++i)
            genEnum(program.output(i));
        line(1, "private " + className + "() {");
        line(1, "}");
        line(0, "");
        genEvaluate();
        line(0, "}");
        return out.toString();
    }

    private void checkIdentifiers() {
        Map types = new HashMap();
        for (int i = 0; i < program.inputCount(); ++i)
            checkDomain(types, program.input(i));
        for (int i = 0; i < program.outputCount(); ++i)
            checkDomain(types, program.output(i));
    }

    private static void checkDomain(Map types, Domain domain) {
        Object old = types.put(ident(domain.name), domain.name);
        if (old != null)
            throw new CompileException(0, 0, "Variables " + old + " and "
                + domain.name + " map to the same Java name "
                + ident(domain.name));
        Map names = new HashMap();
        String[] values = domain.values();
        for (int i = 0; i < values.length; ++i) {
            old = names.put(ident(values[i]), values[i]);
            if (old != null)
                throw new CompileException(0, 0, "Values " + old + " and "
                    + values[i] + " of " + domain.name
                    + " map to the same Java name " + ident(values[i]));
        }
    }

    private void genEnum(Domain domain) {
        String[] values = domain.sortedValues();
        line(1, "/** " + (domain.kind == Domain.INPUT ? "Input " : "Output ")
                + comment(domain.name) + ". */");
        line(1, "public enum " + ident(domain.name) + " {");
        for (int i = 0; i < values.length; ++i)
            line(2, ident(values[i]) + (i == values.length - 1 ? ";" : ","));
        line(0, "");
        line(2, "/** 1-based rank of the value in alphabetical order. */");
        line(2, "public int code() {");
        line(3, "return ordinal() + 1;");
        line(2, "}");
        line(1, "}");
        line(0, "");
    }

    private void genEvaluate() {
        StringBuffer params = new StringBuffer();
        for (int i = 0; i < program.inputCount(); ++i) {
            String name = ident(program.input(i).name);
            if (i != 0)
                params.append(", ");
            params.append(name).append(' ').append(name);
        }
        line(1, "/**");
        line(1, " * Evaluates the decision table"
                + (program.depth > 0 ? " (max depth: " + program.depth + ")."
                                     : "."));
        line(1, " *");
        line(1, program.outputCount() == 0 ? " * @return empty array"
                : " * @return " + outputList(false)
                  + " in this order, null where no value was assigned");
        line(1, " */");
        line(1, "public static Enum<?>[] evaluate(" + params + ") {");
        for (int i = 0; i < program.outputCount(); ++i) {
            String name = ident(program.output(i).name);
            line(2, name + " $" + name + " = " + UNSET + ';');
        }
        line(2, "int " + STATE + " = 0;");
        line(2, "while (true) {");
        int[] guards = rp.guards();
        for (int i = 0; i < guards.length; ++i)
            genGuard(guards[i]);
        line(3, "throw new IllegalStateException(\"No transition from state \" + "
                + STATE + ");");
        line(2, "}");
        line(1, "}");
    }

    private void genGuard(int state) {
        line(3, "if (" + STATE + " == " + state + ") {");
        boolean reachable = true;
        for (int i = 0, n = program.size(); i < n; ++i) {
            if (rp.state(i) != state)
                continue;
            Directive st = program.statement(i);
            if (st instanceof Label) {
                int id = ((Label) st).id;
                if (id != 0 && reachable) {
                    transfer(id);
                    reachable = false;
                }
            } else if (!reachable) {
                warnings.add(new CompileException(st.line, st.col,
                    "Unreachable statement " + st.str() + " in state "
                    + state + " is not generated"));
            } else if (st instanceof Test) {
                Test t = (Test) st;
                line(4, "switch (" + ident(t.var) + ") {");
                line(4, "case " + ident(t.val) + ':');
                line(5, STATE + " = " + t.target + ';');
                line(5, "continue;");
                line(4, "}");
                int ft = rp.fallthrough(i);
                if (ft != ResolvedProgram.NO_TARGET && rp.endsBlock(i)) {
                    transfer(ft);
                    reachable = false;
                }
            } else if (st instanceof Jump) {
                int target = ((Jump) st).target;
                if (target == 0)
                    line(4, "return new Enum<?>[] { " + outputList(true)
                            + " };");
                else
                    transfer(target);
                reachable = false;
            } else if (st instanceof Assign) {
                Assign a = (Assign) st;
                line(4, '$' + ident(a.var) + " = " + ident(a.var) + '.'
                        + ident(a.val) + ';');
            }
        }
        line(3, "}");
    }

    // javac reads unicode escapes inside comments too
    private static String comment(String s) {
        return s.replace("\\", "\\\\").replace("*/", "* /");
    }

    private void transfer(int state) {
        line(4, STATE + " = " + state + ';');
        line(4, "continue;");
    }

    private String outputList(boolean locals) {
        StringBuffer buf = new StringBuffer();
        for (int i = 0; i < program.outputCount(); ++i) {
            if (i != 0)
                buf.append(", ");
            if (locals)
                buf.append('$');
            buf.append(ident(program.output(i).name));
        }
        return buf.toString();
    }

    private void line(int indent, String s) {
        if (s.length() != 0)
            for (int i = 0; i < indent; ++i)
                out.append("    ");
        out.append(s).append('\n');
    }
}
