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

import java.io.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line front end.
 *
 * <pre>
 * psuc [-encoding charset] [-package name] [-d directory] [-parse-tree]
 *      [-no-validate] file.psu...
 * </pre>
 *
 * Without -d the generated code goes to standard output. Nothing is
 * written unless every file compiles.
 */
public class PsuC {
    static final String USAGE =
        "Usage: psuc [-encoding charset] [-package name] [-d directory]\n" +
        "            [-parse-tree] [-no-validate] file.psu...";

    public static void main(String[] argv) {
        int status = run(argv, System.out, System.err);
        System.out.flush();
        if (status != 0)
            System.exit(status);
    }

    static int run(String[] argv, PrintStream out, PrintStream err) {
        Compiler compiler = new Compiler();
        List files = new ArrayList();
        String target = null;
        int flags = 0;
        for (int i = 0; i < argv.length; ++i) {
            String arg = argv[i];
            if (!arg.startsWith("-") || arg.length() == 1) {
                files.add(arg);
            } else if (arg.equals("-parse-tree")) {
                flags |= Compiler.CF_PRINT_PARSE_TREE;
            } else if (arg.equals("-no-validate")) {
                flags |= Compiler.CF_NO_VALIDATE;
            } else if (arg.equals("-h") || arg.equals("-help")) {
                out.println(USAGE);
                return 0;
            } else if (i + 1 >= argv.length) {
                err.println("psuc: " + arg + " expects an argument");
                return 1;
            } else if (arg.equals("-encoding")) {
                compiler.setSourceCharset(argv[++i]);
            } else if (arg.equals("-package")) {
                compiler.setPackageName(argv[++i]);
            } else if (arg.equals("-d")) {
                target = argv[++i];
            } else {
                err.println("psuc: Unexpected option " + arg);
                err.println(USAGE);
                return 1;
            }
        }
        if (files.isEmpty()) {
            err.println(USAGE);
            return 1;
        }
        compiler.setFlags(flags);

        final List units = new ArrayList();
        CodeWriter buffer = new CodeWriter() {
            public void writeSource(String className, String code) {
                units.add(new String[] { className, code });
            }
        };
        try {
            for (int i = 0; i < files.size(); ++i)
                compiler.compileFile((String) files.get(i), buffer);
        } catch (CompileException ex) {
            err.println("psuc: " + ex.getMessage());
            return 1;
        } catch (IOException ex) {
            err.println("psuc: " + ex.getMessage());
            return 1;
        } finally {
            CompileException[] warnings = compiler.getWarnings();
            for (int i = 0; i < warnings.length; ++i)
                err.println("psuc: warning: " + warnings[i].getMessage());
        }
        CodeWriter writer = target == null ? null
                                : new FileWriter(target, "UTF-8");
        try {
            for (int i = 0; i < units.size(); ++i) {
                String[] unit = (String[]) units.get(i);
                if (writer == null)
                    out.print(unit[1]);
                else
                    writer.writeSource(unit[0], unit[1]);
            }
        } catch (CompileException ex) {
            err.println("psuc: " + ex.getMessage());
            return 1;
        } catch (IOException ex) {
            err.println("psuc: " + ex.getMessage());
            return 1;
        }
        return 0;
    }
}
