package com.codelogickeep.agent.llm.framework.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Message Tests")
class MessageTest {

    @Test
    @DisplayName("工厂方法设置对应角色")
    void factoriesSetRole() {
        assertEquals(Role.SYSTEM, Message.system("be concise").role());
        assertEquals(Role.USER, Message.user("hi").role());
        assertEquals(Role.ASSISTANT, Message.assistant("hello").role());
    }

    @Test
    @DisplayName("空内容原样保留")
    void emptyContentIsLegal() {
        Message msg = Message.user("");

        assertEquals("", msg.content());
    }

    @Test
    @DisplayName("null 内容或角色被拒绝")
    void nullIsRejected() {
        assertThrows(NullPointerException.class, () -> Message.user(null));
        assertThrows(NullPointerException.class, () -> new Message(null, "x"));
    }

    @Test
    @DisplayName("值语义相等")
    void valueEquality() {
        assertEquals(Message.user("hi"), new Message(Role.USER, "hi"));
        assertNotEquals(Message.user("hi"), Message.assistant("hi"));
    }

    @Test
    void wireNamesAreLowercase() {
        assertEquals("system", Role.SYSTEM.wireName());
        assertEquals("user", Role.USER.wireName());
        assertEquals("assistant", Role.ASSISTANT.wireName());
    }

    @Test
    void isSystemOnlyForSystemRole() {
        assertTrue(Message.system("s").isSystem());
        assertFalse(Message.user("u").isSystem());
        assertFalse(Message.assistant("a").isSystem());
    }
}
