package org.muma.kvlite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 协议编解码
 * <p>
 * 解析：ByteBuf 的 readerIndex 就是外部可变游标，同一个缓冲区里背靠背的多条消息
 * 可以连续调用 {@link #parse(ByteBuf)} 读出，不需要复制。
 * 解析失败时游标停在出错位置，调用方自行决定是否回滚 (参见 RespDecoder)。
 * <p>
 * 输入只接受 Array (*) 和 BulkString ($) 两种形式；输出支持全部六种值。
 */
public final class RespCodec {

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    // 数组预分配上限：声明的长度不可信，不能按它直接分配
    private static final int MAX_PREALLOCATED_ELEMENTS = 64;

    // 数组嵌套层数上限，防止递归下降栈溢出
    static final int MAX_NESTING_DEPTH = 32;

    private RespCodec() {
    }

    // ------------------------------------------------------------------
    // 解析
    // ------------------------------------------------------------------

    public static RedisMessage parse(ByteBuf in) {
        return parse(in, 0);
    }

    private static RedisMessage parse(ByteBuf in, int depth) {
        if (!in.isReadable()) {
            throw new RespProtocolException(ProtocolErrorKind.INCOMPLETE_INPUT, "Empty data");
        }

        byte typeByte = in.getByte(in.readerIndex());
        return switch (typeByte) {
            case ASTERISK_BYTE -> {
                if (depth >= MAX_NESTING_DEPTH) {
                    throw new RespProtocolException(ProtocolErrorKind.NESTING_TOO_DEEP,
                            "Array nesting exceeds " + MAX_NESTING_DEPTH + " levels");
                }
                in.skipBytes(1);
                yield parseArray(in, depth);
            }
            case DOLLAR_BYTE -> {
                in.skipBytes(1);
                yield parseBulkString(in);
            }
            default -> throw new RespProtocolException(ProtocolErrorKind.UNSUPPORTED_TYPE,
                    "Unsupported or invalid RESP prefix '" + printable(typeByte) + "'");
        };
    }

    /**
     * 便捷入口：解析字节数组开头的一条消息
     */
    public static RedisMessage parse(byte[] data) {
        return parse(Unpooled.wrappedBuffer(data));
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private static RedisArray parseArray(ByteBuf in, int depth) {
        long count = readLong(in);
        if (count < 1) {
            throw new RespProtocolException(ProtocolErrorKind.MALFORMED_ARRAY_LENGTH,
                    "Expected a command array of length at least 1, got " + count);
        }

        List<RedisMessage> elements = new ArrayList<>((int) Math.min(count, MAX_PREALLOCATED_ELEMENTS));
        for (long i = 0; i < count; i++) {
            // 递归下降
            elements.add(parse(in, depth + 1));
        }
        return new RedisArray(elements);
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private static RedisMessage parseBulkString(ByteBuf in) {
        long length = readLong(in);
        if (length < 0) {
            return NullMessage.INSTANCE;
        }
        if (in.readableBytes() < length) {
            throw new RespProtocolException(ProtocolErrorKind.INCOMPLETE_INPUT,
                    "Incomplete bulk string data: expected " + length + " bytes, got " + in.readableBytes());
        }

        byte[] content = new byte[(int) length];
        in.readBytes(content);

        // 读取末尾的 CRLF
        consumeCrlf(in);
        return new BulkString(content);
    }

    // 读取 CRLF 结尾的十进制整数
    private static long readLong(ByteBuf in) {
        int start = in.readerIndex();
        int cr = in.indexOf(start, in.writerIndex(), CR);
        if (cr < 0) {
            throw new RespProtocolException(ProtocolErrorKind.INCOMPLETE_INPUT, "Incomplete integer line");
        }

        byte[] digits = new byte[cr - start];
        in.readBytes(digits);
        String text = decodeUtf8(digits);
        long value;
        try {
            value = Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new RespProtocolException(ProtocolErrorKind.MALFORMED_INTEGER,
                    "Invalid integer format, " + text);
        }

        consumeCrlf(in);
        return value;
    }

    private static void consumeCrlf(ByteBuf in) {
        if (in.readableBytes() < 2) {
            throw new RespProtocolException(ProtocolErrorKind.INCOMPLETE_INPUT, "Incomplete CRLF terminator");
        }
        int idx = in.readerIndex();
        if (in.getByte(idx) != CR || in.getByte(idx + 1) != LF) {
            throw new RespProtocolException(ProtocolErrorKind.MISSING_TERMINATOR, "Missing CRLF terminator");
        }
        in.skipBytes(2);
    }

    private static String decodeUtf8(byte[] bytes) {
        // String 构造器会把非法字节替换成 U+FFFD，这里要求严格报错
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new RespProtocolException(ProtocolErrorKind.INVALID_ENCODING, "Invalid utf-8");
        }
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : "\\x" + ByteBufUtil.hexDump(new byte[]{b});
    }

    // ------------------------------------------------------------------
    // 序列化
    // ------------------------------------------------------------------

    public static void serialize(RedisMessage msg, ByteBuf out) {
        if (msg instanceof SimpleString s) {
            out.writeByte(PLUS_BYTE);
            writeLine(out, s.content());
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte(MINUS_BYTE);
            writeLine(out, e.content());
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(COLON_BYTE);
            writeDecimal(out, i.value());
        } else if (msg instanceof BulkString b) {
            out.writeByte(DOLLAR_BYTE);
            writeDecimal(out, b.content().length);
            out.writeBytes(b.content());
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisArray a) {
            out.writeByte(ASTERISK_BYTE);
            writeDecimal(out, a.size());
            for (RedisMessage element : a.elements()) {
                serialize(element, out);
            }
        } else if (msg instanceof NullMessage) {
            out.writeBytes(NULL_BULK);
        }
    }

    // 单行回复不能含 CR/LF，否则客户端会读出多条回复；错误文本里可能带着客户端原始字节
    private static void writeLine(ByteBuf out, String text) {
        String line = text.indexOf('\r') < 0 && text.indexOf('\n') < 0
                ? text
                : text.replace('\r', ' ').replace('\n', ' ');
        out.writeBytes(line.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    public static byte[] serialize(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            serialize(msg, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    private static void writeDecimal(ByteBuf out, long value) {
        out.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(CRLF);
    }
}
