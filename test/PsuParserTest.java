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

import java.util.List;
import org.junit.jupiter.api.Test;
import psuc.compiler.PsuParser.Directive;

import static org.junit.jupiter.api.Assertions.*;

class PsuParserTest {

    static List parse(String src) {
        return new PsuParser.Parser(src.toCharArray()).parse();
    }

    static String dump(List directives) {
        StringBuffer buf = new StringBuffer();
        for (int i = 0; i < directives.size(); ++i)
            buf.append(((Directive) directives.get(i)).str()).append('\n');
        return buf.toString();
    }

    @Test void commaForm() {
        List d = parse("I,mode,on\nO,lamp,off\nD,4\nL,1\nT,mode,on,2\n"
                       + "R,lamp,off\nJ,0\n");
        assertEquals("(I mode on)\n(O lamp off)\n(D 4)\n(L 1)\n"
                     + "(T mode on 2)\n(R lamp off)\n(J 0)\n", dump(d));
    }

    @Test void symbolForm() {
        List d = parse("# E mode on\n# R lamp off\n# D 4\n< 1\n"
                       + ": mode on > 2\n= lamp off\n> 0\n");
        assertEquals("(I mode on)\n(O lamp off)\n(D 4)\n(L 1)\n"
                     + "(T mode on 2)\n(R lamp off)\n(J 0)\n", dump(d));
    }

    @Test void bothFormsGiveSameStream() throws Exception {
        String comma = new String(new Compiler().readSource(
            Fixtures.path("signal.psu")));
        String symbols = new String(new Compiler().readSource(
            Fixtures.path("signal-symbols.psu")));
        assertEquals(dump(parse(comma)), dump(parse(symbols)));
    }

    @Test void blankAndUnknownLinesAreIgnored() {
        List d = parse("\n   \nX,foo,bar\n# just a comment\nhello world\n"
                       + "#\nLL,3\nL,5\n\r\n");
        assertEquals("(L 5)\n", dump(d));
    }

    @Test void quotedFieldsMayContainCommas() {
        List d = parse("I,\"speed, km/h\",\"over \"\"90\"\"\"\n");
        PsuParser.Decl decl = (PsuParser.Decl) d.get(0);
        assertEquals("speed, km/h", decl.var);
        assertEquals("over \"90\"", decl.val);
    }

    @Test void crLfLineEndings() {
        List d = parse("L,1\r\nJ,0\r\n");
        assertEquals("(L 1)\n(J 0)\n", dump(d));
    }

    @Test void extraFieldsAreIgnored() {
        assertEquals("(J 3)\n", dump(parse("J,3,extra\n")));
        assertEquals("(R x y)\n", dump(parse("= x y z\n")));
    }

    @Test void directivesRecordTheirPosition() {
        List d = parse("# header\n\n  < 7\nT,a,b,7\n");
        Directive label = (Directive) d.get(0);
        Directive test = (Directive) d.get(1);
        assertEquals(3, label.line);
        assertEquals(3, label.col);
        assertEquals(4, test.line);
        assertEquals(1, test.col);
    }

    @Test void testWithoutTargetIsMalformed() {
        CompileException ex = assertThrows(CompileException.class,
            () -> parse("L,1\nT,mode,on\n"));
        assertEquals(2, ex.getLine());
        assertTrue(ex.getMessage().contains("expected 4 fields, got 3"),
                   ex.getMessage());
        assertTrue(ex.getMessage().contains("T,mode,on"), ex.getMessage());
    }

    @Test void symbolTestNeedsArrow() {
        CompileException ex = assertThrows(CompileException.class,
            () -> parse(": mode on 2 x\n"));
        assertTrue(ex.getMessage().contains("Expected '>'"));
    }

    @Test void symbolDeclarationWithoutValueIsMalformed() {
        CompileException ex = assertThrows(CompileException.class,
            () -> parse("# E mode\n"));
        assertTrue(ex.getMessage().contains("Malformed input directive"));
    }

    @Test void labelMustBeANumber() {
        CompileException ex = assertThrows(CompileException.class,
            () -> parse("L,one\n"));
        assertTrue(ex.getMessage().contains("non-negative number"));
        assertThrows(CompileException.class, () -> parse("> -2\n"));
    }

    @Test void emptySource() {
        assertTrue(parse("").isEmpty());
    }

    @Test void byteOrderMarkIsSkipped() {
        List d = parse("\uFEFFI,mode,on\n# E mode off\n");
        assertEquals("(I mode on)\n(I mode off)\n", dump(d));
        assertEquals(1, ((Directive) d.get(0)).line);
        assertEquals(1, ((Directive) d.get(0)).col);
        d = parse("\uFEFF< 4\n");
        assertEquals("(L 4)\n", dump(d));
    }
}
