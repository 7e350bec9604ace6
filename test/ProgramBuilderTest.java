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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static psuc.compiler.Fixtures.program;

class ProgramBuilderTest {

    @Test void firstDeclarationFixesOrder() {
        Program p = program("I,A,x\nI,B,y\nI,A,z\n");
        assertEquals(2, p.inputCount());
        assertEquals("A", p.input(0).name);
        assertEquals("B", p.input(1).name);
        assertArrayEquals(new String[] { "x", "z" }, p.input(0).values());
    }

    @Test void valuesAreDeduplicated() {
        Program p = program("O,lamp,on\nO,lamp,off\nO,lamp,on\nO,lamp,On\n");
        assertArrayEquals(new String[] { "on", "off", "On" },
                          p.output(0).values());
    }

    @Test void inputsAndOutputsAreSeparate() {
        Program p = program("O,out,a\nI,in,b\n");
        assertEquals(1, p.inputCount());
        assertEquals(1, p.outputCount());
        assertEquals(Domain.INPUT, p.input(0).kind);
        assertEquals(Domain.OUTPUT, p.output(0).kind);
        assertNull(p.findInput("out"));
    }

    @Test void lastDepthWins() {
        assertEquals(7, program("D,3\nD,7\n").depth);
        assertEquals(Program.NO_DEPTH, program("L,1\n").depth);
    }

    @Test void bodyKeepsFileOrder() {
        Program p = program("L,1\nI,a,x\nT,a,x,2\nL,0\nR,o,v\nJ,0\nO,o,v\n");
        assertEquals(5, p.size());
        assertEquals("(L 1)", p.statement(0).str());
        assertEquals("(T a x 2)", p.statement(1).str());
        assertEquals("(L 0)", p.statement(2).str());
        assertEquals("(R o v)", p.statement(3).str());
        assertEquals("(J 0)", p.statement(4).str());
    }

    @Test void builtProgramDoesNotChange() {
        ProgramBuilder builder = new ProgramBuilder("t");
        builder.addAll(new PsuParser.Parser("I,a,x\n".toCharArray()).parse());
        Program p = builder.build();
        assertThrows(IllegalStateException.class,
            () -> builder.add(new PsuParser.Decl(Domain.INPUT, "a", "y")));
        assertArrayEquals(new String[] { "x" }, p.input(0).values());
    }

    @Test void valuesSortForCodes() {
        Domain d = program("I,answer,yes\nI,answer,no\n").input(0);
        assertArrayEquals(new String[] { "yes", "no" }, d.values());
        assertArrayEquals(new String[] { "no", "yes" }, d.sortedValues());
    }
}
