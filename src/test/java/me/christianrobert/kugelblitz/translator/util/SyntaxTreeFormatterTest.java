package me.christianrobert.kugelblitz.translator.util;

import me.christianrobert.kugelblitz.translator.ast.BinOp;
import me.christianrobert.kugelblitz.translator.ast.BinaryOperator;
import me.christianrobert.kugelblitz.translator.ast.FunctionDef;
import me.christianrobert.kugelblitz.translator.ast.Module;
import me.christianrobert.kugelblitz.translator.ast.Name;
import me.christianrobert.kugelblitz.translator.ast.Return;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SyntaxTreeFormatter utility.
 */
class SyntaxTreeFormatterTest {

    @Test
    void formatNullTree() {
        assertEquals("(null tree)", SyntaxTreeFormatter.format(null));
    }

    @Test
    void formatFunction() {
        FunctionDef add = new FunctionDef("add", Arrays.asList("a", "b"), Collections.singletonList(
            new Return(new BinOp(new Name("a"), BinaryOperator.ADD, new Name("b")))));
        Module module = new Module(Collections.singletonList(add));

        String formatted = SyntaxTreeFormatter.format(module);

        assertEquals("MODULE\n"
            + "  FUNCTION_DEF [add(a, b)]\n"
            + "    RETURN\n"
            + "      BIN_OP\n"
            + "        NAME [a]\n"
            + "        OPERATOR [ADD]\n"
            + "        NAME [b]\n", formatted);
    }

    @Test
    void longLabelsAreTruncated() {
        String longName = "a_really_long_identifier_that_keeps_going_and_going_forever";

        String formatted = SyntaxTreeFormatter.format(new Name(longName));

        assertTrue(formatted.startsWith("NAME [a_really_long"));
        assertTrue(formatted.contains("...]"));
    }
}
