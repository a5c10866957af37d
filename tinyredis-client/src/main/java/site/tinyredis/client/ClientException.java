package site.tinyredis.client;

import java.io.IOException;

/**
 * 客户端调用失败：服务器返回错误帧、响应格式不符合预期或连接中断
 */
public class ClientException extends IOException {

    public ClientException(final String message) {
        super(message);
    }

    public ClientException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
