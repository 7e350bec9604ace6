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

/**
 * Writes generated sources below a target directory,
 * in subdirectories following the package.
 */
class FileWriter implements CodeWriter {
    private String target;
    private String charset;

    FileWriter(String target, String charset) {
        if (target.length() != 0 && !target.endsWith("/"))
            target += '/';
        this.target = target;
        this.charset = charset;
    }

    public void writeSource(String className, String code) {
        String name = target + className.replace('.', '/') + ".java";
        try {
            int sl = name.lastIndexOf('/');
            if (sl > 0) {
                new File(name.substring(0, sl)).mkdirs();
            }
            Writer out = new OutputStreamWriter(
                                new FileOutputStream(name), charset);
            try {
                out.write(code);
            } finally {
                out.close();
            }
        } catch (IOException ex) {
            throw new CompileException(null, ex,
                        "Error writing " + name + ": " + ex.getMessage());
        }
    }
}
