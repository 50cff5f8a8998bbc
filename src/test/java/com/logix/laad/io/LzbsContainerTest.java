package com.logix.laad.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.logix.laad.CompiledUnit;
import com.logix.laad.CompilerOptions;
import com.logix.laad.LaadCompiler;
import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.*;

public class LzbsContainerTest {

    @Test
    public void testCompiledUnitSurvivesContainer() throws Exception {
        CompiledUnit unit = new LaadCompiler(CompilerOptions.defaults())
                .compile("b = logix.input.button\nb -> for (i in 0..5) {\n  l = logix.io.log\n  i -> l.message\n}");
        JsonNode tree = LnjReader.tree(unit.lnj());

        byte[] container = LzbsContainer.encode(tree);
        assertTrue(container.length > 0);
        assertEquals(tree, LzbsContainer.decode(container));
    }

    @Test
    public void testContainerIsCompressed() throws Exception {
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < 50; i++)
            source.append("\"line ").append(i).append("\" -> logix.io.display\n");
        String lnj = new LaadCompiler(CompilerOptions.defaults()).compile(source.toString()).lnj();
        byte[] container = LzbsContainer.encode(LnjReader.tree(lnj));
        assertTrue(container.length < lnj.length() / 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRootMustBeObject() throws Exception {
        LzbsContainer.encode(LnjReader.tree("[1, 2]"));
    }

    @Test(expected = IOException.class)
    public void testGarbageRejected() throws Exception {
        // properties byte out of range
        LzbsContainer.decode(new byte[] { (byte) 0xFF, 0, 0, 1, 0, 0, 0, 0, 0, 0, 0, 0, 0 });
    }
}
