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

import java.io.File;
import java.io.IOException;
import org.apache.tools.ant.BuildException;
import org.apache.tools.ant.Project;
import org.apache.tools.ant.taskdefs.MatchingTask;

/**
 * Ant task translating decision table pseudocode into Java sources.
 *
 * <pre>
 * &lt;taskdef name="psuc" classname="psuc.compiler.PsuTask"/&gt;
 * &lt;psuc srcdir="tables" destdir="gen" package="tables"/&gt;
 * </pre>
 */
public class PsuTask extends MatchingTask {
    private File dir;
    private String target = "";
    private String packageName;
    private String encoding = "UTF-8";
    private boolean validate = true;

    public void setSrcDir(String dir) {
        this.dir = new File(dir);
    }

    public void setDestDir(String dir) {
        target = dir;
    }

    public void setPackage(String packageName) {
        this.packageName = packageName;
    }

    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    public void setValidate(boolean validate) {
        this.validate = validate;
    }

    public void execute() {
        if (dir == null)
            dir = getProject().getBaseDir();
        if (!fileset.hasPatterns())
            setIncludes("**/*.psu");
        String[] files = getDirectoryScanner(dir).getIncludedFiles();
        String destDir = target.length() != 0 ? target
                            : getProject().getBaseDir().getPath();
        CodeWriter writer = new FileWriter(destDir, encoding);
        Compiler compiler = new Compiler();
        compiler.setSourceCharset(encoding);
        compiler.setPackageName(packageName);
        compiler.setFlags(validate ? 0 : Compiler.CF_NO_VALIDATE);
        log("Compiling " + files.length + " files.");
        try {
            for (int i = 0; i < files.length; ++i) {
                String name = compiler.compileFile(
                    new File(dir, files[i]).getPath(), writer);
                log(files[i] + " -> " + name, Project.MSG_VERBOSE);
            }
        } catch (CompileException ex) {
            throw new BuildException(ex.getMessage());
        } catch (IOException ex) {
            throw new BuildException(ex.getMessage(), ex);
        }
        CompileException[] warnings = compiler.getWarnings();
        for (int i = 0; i < warnings.length; ++i)
            log(warnings[i].getMessage(), Project.MSG_WARN);
    }
}
