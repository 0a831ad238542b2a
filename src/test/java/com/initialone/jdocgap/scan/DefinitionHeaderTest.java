package com.initialone.jdocgap.scan;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionHeaderTest {

    @Test
    void colonInsideParametersIsSkipped() {
        String src = "def f(a: int, b: dict = {'k': 1}) -> int:\n    return a\n";
        assertEquals(src.indexOf(" -> int:") + 7, DefinitionHeader.colonOffset(src, 0));
    }

    @Test
    void colonInStringDefaultIsSkipped() {
        String src = "def f(sep=':'):\n    pass\n";
        assertEquals(src.indexOf("):") + 1, DefinitionHeader.colonOffset(src, 0));
    }

    @Test
    void headerLineOfMultiLineSignature() {
        String src = "class A:\n    def m(self,\n          x):\n        pass\n";
        assertEquals(2, DefinitionHeader.headerLineIndex(src, src.indexOf("def m")));
    }

    @Test
    void missingColonGivesMinusOne() {
        assertEquals(-1, DefinitionHeader.colonOffset("def broken(a, b)\n", 0));
    }
}
