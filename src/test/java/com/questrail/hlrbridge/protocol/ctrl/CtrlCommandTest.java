package com.questrail.hlrbridge.protocol.ctrl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class CtrlCommandTest
{
    @Test
    void getWireText()
    {
        assertEquals("GET 12345 bts.0.oml-connection-state",
                new CtrlCommand(CtrlCommand.Action.GET, 12345, "bts.0.oml-connection-state", null).toWireText());
    }

    @Test
    void setWireText()
    {
        assertEquals("SET 10001 rate_ctr.abs 1",
                new CtrlCommand(CtrlCommand.Action.SET, 10001, "rate_ctr.abs", "1").toWireText());
    }

    @Test
    void generatedIdsStayInRange()
    {
        for (int i = 0; i < 1000; i++) {
            int id = CtrlCommand.get("x").id();
            assertTrue(id >= CtrlCommand.MIN_ID && id <= CtrlCommand.MAX_ID, "id " + id);
        }
    }

    @Test
    void rejectsBadArguments()
    {
        assertThrows(IllegalArgumentException.class, () -> CtrlCommand.get("two words"));
        assertThrows(IllegalArgumentException.class, () -> CtrlCommand.get(""));
        assertThrows(NullPointerException.class, () -> CtrlCommand.set("x", null));
        assertThrows(IllegalArgumentException.class,
                () -> new CtrlCommand(CtrlCommand.Action.GET, 10000, "x", "1"));
    }
}
