package site.tinyredis.protocol;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FrameParser参数游标测试")
class FrameParserTest {

    @Test
    @DisplayName("按顺序读取各类参数")
    void testSequentialRead() throws Exception {
        ArrayFrame frame = ArrayFrame.of(
                BulkString.fromString("SET"),
                new SimpleString("key"),
                BulkString.fromString("value"),
                BulkString.fromString("60"),
                IntegerFrame.valueOf(5));

        FrameParser parser = new FrameParser(frame);
        assertEquals("SET", parser.nextString());
        assertEquals("key", parser.nextString());
        assertArrayEquals("value".getBytes(), parser.nextBytes());
        assertEquals(60L, parser.nextLong());
        assertEquals(5L, parser.nextLong());
        assertFalse(parser.hasNext());
        parser.finish();
    }

    @Test
    @DisplayName("非数组帧不能作为请求")
    void testRejectsNonArray() {
        assertThrows(ProtocolException.class, () -> new FrameParser(SimpleString.OK));
    }

    @Test
    @DisplayName("参数不足、类型不符、多余参数均报错")
    void testErrors() throws Exception {
        FrameParser exhausted = new FrameParser(ArrayFrame.ofBulkStrings("get"));
        exhausted.nextString();
        assertThrows(ProtocolException.class, exhausted::nextString);

        FrameParser wrongType = new FrameParser(ArrayFrame.of(NullFrame.INSTANCE));
        assertThrows(ProtocolException.class, wrongType::nextString);

        FrameParser notNumber = new FrameParser(ArrayFrame.ofBulkStrings("abc"));
        assertThrows(ProtocolException.class, notNumber::nextLong);

        FrameParser trailing = new FrameParser(ArrayFrame.ofBulkStrings("get", "k", "extra"));
        trailing.nextString();
        trailing.nextString();
        ProtocolException e = assertThrows(ProtocolException.class, trailing::finish);
        assertTrue(e.getMessage().contains("expected end of frame"));
    }
}
