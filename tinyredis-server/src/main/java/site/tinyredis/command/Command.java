package site.tinyredis.command;

import site.tinyredis.command.impl.Unknown;
import site.tinyredis.database.Db;
import site.tinyredis.protocol.Frame;
import site.tinyredis.protocol.FrameParser;
import site.tinyredis.protocol.ProtocolException;
import site.tinyredis.server.handler.Connection;

import java.util.Locale;

/**
 * 客户端请求对应的命令
 *
 * <p>命令集合是封闭的，由{@link CommandType}枚举列出。每个实现类只持有自己的参数，
 * 解析在构造阶段完成，执行阶段只与数据库和连接交互。
 *
 * <p>执行约定：
 * <ul>
 *   <li>正常结果（包括键不存在）写回对应的响应帧，不抛异常
 *   <li>可恢复的失败以{@link CommandException}报告，由连接处理器写回错误帧
 *   <li>标记为致命的{@link CommandException}在写回错误帧后关闭连接
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface Command {

    /**
     * 获取命令类型
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 获取命令名，用于错误提示
     *
     * @return 小写的命令名
     */
    default String getName() {
        return getType().getName();
    }

    /**
     * 执行命令并通过连接写回响应
     *
     * @param db 共享数据库
     * @param connection 当前连接
     * @throws CommandException 命令无法在当前连接状态下执行
     */
    void apply(Db db, Connection connection) throws CommandException;

    /**
     * 将请求帧解析为命令
     *
     * <p>第一个元素是命令名（大小写不敏感），未识别的命令名解析为{@link Unknown}，
     * 而不是解析失败。
     *
     * @param frame 解码后的请求帧
     * @return 命令实例
     * @throws ProtocolException 帧不是数组、参数缺失、格式错误或有多余参数
     */
    static Command fromFrame(final Frame frame) throws ProtocolException {
        final FrameParser parser = new FrameParser(frame);
        final String name = parser.nextString().toLowerCase(Locale.ROOT);

        final CommandType type = CommandType.findByName(name);
        if (type == null) {
            return new Unknown(name);
        }

        final Command command = type.parse(parser);
        parser.finish();
        return command;
    }
}
