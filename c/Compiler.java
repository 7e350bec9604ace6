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
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Translation driver: reads pseudocode, builds and resolves the program
 * and generates the evaluator class.
 *
 * <pre>
 * Compiler compiler = new Compiler();
 * compiler.setPackageName("tables");
 * String code = compiler.compile("power", source);
 * </pre>
 *
 * A Compiler keeps only its configuration and collected warnings,
 * so separate instances can translate in parallel.
 */
public final class Compiler {
    public static final int CF_PRINT_PARSE_TREE = 1;
    public static final int CF_NO_VALIDATE      = 2;

    private final static Logger LOG =
        Logger.getLogger(Compiler.class.getName());

    String sourceCharset = "UTF-8";
    String packageName;
    int flags;
    private final List warnings = new ArrayList();
    private String currentSrc;

    public void setSourceCharset(String charset) {
        sourceCharset = charset;
    }

    public void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    void warn(CompileException ex) {
        if (ex.fn == null)
            ex.fn = currentSrc;
        warnings.add(ex);
    }

    /**
     * Warnings of all translations so far. They are only collected here,
     * reporting them is up to the caller.
     */
    public CompileException[] getWarnings() {
        return (CompileException[])
            warnings.toArray(new CompileException[warnings.size()]);
    }

    /**
     * Module name of a source file: the file name without directories
     * and extension.
     */
    static String moduleName(String fileName) {
        String name = fileName.substring(
            Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'))
            + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Reads the whole file. The IOException message is meant for the user
     * and names the file once.
     */
    char[] readSource(String fileName) throws IOException {
        Charset charset;
        try {
            charset = Charset.forName(sourceCharset);
        } catch (IllegalArgumentException ex) {
            throw new IOException("Unsupported encoding " + sourceCharset);
        }
        char[] buf = new char[0x8000];
        int l = 0;
        InputStream stream;
        try {
            stream = new FileInputStream(fileName);
        } catch (FileNotFoundException ex) {
            throw new IOException("Can't open " + ex.getMessage());
        }
        try {
            Reader reader = new InputStreamReader(stream, charset);
            for (int n; (n = reader.read(buf, l, buf.length - l)) >= 0; ) {
                if (buf.length - (l += n) < 0x1000) {
                    char[] tmp = new char[buf.length << 1];
                    System.arraycopy(buf, 0, tmp, 0, l);
                    buf = tmp;
                }
            }
        } catch (IOException ex) {
            throw new IOException("Error reading " + fileName + ": "
                                  + ex.getMessage());
        } finally {
            stream.close();
        }
        char[] r = new char[l];
        System.arraycopy(buf, 0, r, 0, l);
        return r;
    }

    /**
     * Parses, builds and resolves the source.
     *
     * @param name module name, used in the generated header and class name
     * @param source pseudocode text in either syntax
     * @throws CompileException on malformed directives or invalid programs
     */
    public ResolvedProgram resolve(String name, char[] source) {
        List directives = new PsuParser.Parser(source).parse();
        Program program =
            new ProgramBuilder(name).addAll(directives).build();
        List found = new ArrayList();
        ResolvedProgram rp = new Resolver(program, found)
                                .resolve((flags & CF_NO_VALIDATE) == 0);
        flushWarnings(found);
        LOG.fine(name + ": " + directives.size() + " directives, "
                 + program.size() + " statements");
        return rp;
    }

    /**
     * Translates the source and returns the generated Java code
     * (or the parse tree, when CF_PRINT_PARSE_TREE is set).
     */
    public String compile(String name, char[] source) {
        return translate(name, name, source)[1];
    }

    /**
     * Compiles a pseudocode file and hands the result to the writer.
     *
     * @return fully qualified name of the generated class
     * @throws IOException when the file can't be read or written
     */
    public String compileFile(String fileName, CodeWriter writer)
            throws IOException {
        String[] unit = translate(fileName, moduleName(fileName),
                                  readSource(fileName));
        writer.writeSource(unit[0], unit[1]);
        return unit[0];
    }

    private String[] translate(String sourceName, String name,
                               char[] source) {
        currentSrc = sourceName;
        try {
            ResolvedProgram rp = resolve(name, source);
            if ((flags & CF_PRINT_PARSE_TREE) != 0)
                return new String[] { name, rp.program.str() + '\n' };
            List found = new ArrayList();
            JavaEmitter emitter = new JavaEmitter(rp, packageName, found);
            String code = emitter.emit();
            flushWarnings(found);
            String className = packageName == null
                || packageName.length() == 0 ? emitter.className
                : packageName + '.' + emitter.className;
            return new String[] { className, code };
        } catch (CompileException ex) {
            if (ex.fn == null)
                ex.fn = sourceName;
            throw ex;
        } finally {
            currentSrc = null;
        }
    }

    private void flushWarnings(List found) {
        for (int i = 0, cnt = found.size(); i < cnt; ++i)
            warn((CompileException) found.get(i));
    }
}
