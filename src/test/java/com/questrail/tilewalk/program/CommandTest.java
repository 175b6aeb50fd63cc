package com.questrail.tilewalk.program;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandTest
{
    @Test
    void loopRepeatCountIsAtLeastOne() {
        assertEquals(1, ((Command.Loop) Command.loop(0, Command.moveForward())).repeatCount());
        assertEquals(1, ((Command.Loop) Command.loop(-4, Command.moveForward())).repeatCount());
        assertEquals(3, ((Command.Loop) Command.loop(3, Command.moveForward())).repeatCount());
    }

    @Test
    void loopCopiesItsChildren() {
        List<Command> body = new ArrayList<>();
        body.add(Command.moveForward());
        Command.Loop loop = (Command.Loop) Command.loop(2, body);

        body.add(Command.turnLeft());

        assertEquals(1, loop.children().size());
        assertThrows(UnsupportedOperationException.class, () -> loop.children().add(Command.turnRight()));
    }

    @Test
    void stepsAreValues() {
        assertEquals(Command.turnLeft(), new Command.Step(StepAction.TURN_LEFT));
        assertNotEquals(Command.turnLeft(), Command.turnRight());
        assertThrows(NullPointerException.class, () -> new Command.Step(null));
    }
}
