package site.tinyredis.command.impl;

import lombok.extern.slf4j.Slf4j;
import site.tinyredis.command.Command;
import site.tinyredis.command.CommandType;
import site.tinyredis.database.Db;
import site.tinyredis.protocol.ErrorFrame;
import site.tinyredis.server.handler.Connection;

/**
 * 未识别的命令，回复一个指明命令名的错误
 */
@Slf4j
public class Unknown implements Command {

    private final String name;

    public Unknown(final String name) {
        this.name = name;
    }

    @Override
    public CommandType getType() {
        return CommandType.UNKNOWN;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void apply(final Db db, final Connection connection) {
        connection.writeFrame(new ErrorFrame("ERR unknown command '" + name + "'"));
        log.debug("未识别的命令: {}", name);
    }
}
