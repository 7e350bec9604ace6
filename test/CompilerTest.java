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

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class CompilerTest {
    @TempDir
    Path tmp;

    @Test void moduleNames() {
        assertEquals("lamp", Compiler.moduleName("lamp.psu"));
        assertEquals("lamp", Compiler.moduleName("/a/b.c/lamp.psu"));
        assertEquals("lamp", Compiler.moduleName("a\\lamp.psu"));
        assertEquals("table.v2", Compiler.moduleName("table.v2.psu"));
        assertEquals("plain", Compiler.moduleName("plain"));
        assertEquals(".hidden", Compiler.moduleName(".hidden"));
    }

    @Test void errorsNameTheSourceFile() throws Exception {
        Path psu = tmp.resolve("broken.psu");
        Files.write(psu, "I,a,x\nL,2\nT,a,y,2\nJ,0\n".getBytes("UTF-8"));
        CompileException ex = assertThrows(CompileException.class,
            () -> new Compiler().compileFile(psu.toString(),
                                             (name, code) -> { }));
        assertEquals(psu.toString(), ex.getFileName());
        assertEquals(3, ex.getLine());
        assertTrue(ex.getMessage().startsWith(psu + ":3:"), ex.getMessage());
    }

    @Test void warningsAreCollected() {
        Compiler compiler = new Compiler();
        compiler.compile("dup", "L,1\nJ,0\nL,1\nJ,0\n".toCharArray());
        CompileException[] warnings = compiler.getWarnings();
        assertEquals(2, warnings.length);
        assertEquals("dup", warnings[0].getFileName());
        assertEquals(3, warnings[0].getLine());
        assertTrue(warnings[0].getMessage().contains("Duplicate label 1"));
        // the second block is never entered
        assertEquals(4, warnings[1].getLine());
    }

    @Test void qualifiedClassName() throws Exception {
        Path psu = tmp.resolve("power.psu");
        Files.write(psu, "J,0\n".getBytes("UTF-8"));
        Compiler compiler = new Compiler();
        compiler.setPackageName("a.b");
        final String[] written = new String[2];
        String name = compiler.compileFile(psu.toString(), (cls, code) -> {
            written[0] = cls;
            written[1] = code;
        });
        assertEquals("a.b.power", name);
        assertEquals(name, written[0]);
        assertTrue(written[1].contains("package a.b;"));
    }

    @Test void sourceCharset() throws Exception {
        Path psu = tmp.resolve("latin.psu");
        Files.write(psu, "I,täht,ü\nJ,0\n".getBytes("ISO-8859-1"));
        Compiler compiler = new Compiler();
        compiler.setSourceCharset("ISO-8859-1");
        ResolvedProgram rp = compiler.resolve("latin",
                                    compiler.readSource(psu.toString()));
        assertEquals("täht", rp.program.input(0).name);
        assertTrue(rp.program.input(0).contains("ü"));
    }

    @Test void largeSourceIsReadWhole() throws Exception {
        StringBuffer src = new StringBuffer("O,o,x\n");
        for (int i = 1; i <= 5000; ++i)
            src.append("L,").append(i).append("\nJ,")
               .append(i == 5000 ? 0 : i + 1).append('\n');
        Path psu = tmp.resolve("big.psu");
        Files.write(psu, src.toString().getBytes("UTF-8"));
        Compiler compiler = new Compiler();
        char[] text = compiler.readSource(psu.toString());
        assertEquals(src.length(), text.length);
        assertEquals(5001, compiler.resolve("big", text).guards().length);
    }
}
