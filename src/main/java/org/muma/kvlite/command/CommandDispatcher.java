package org.muma.kvlite.command;

import org.muma.kvlite.command.impl.connection.EchoCommand;
import org.muma.kvlite.command.impl.connection.PingCommand;
import org.muma.kvlite.command.impl.key.DelCommand;
import org.muma.kvlite.command.impl.key.ExistsCommand;
import org.muma.kvlite.command.impl.key.PTTLCommand;
import org.muma.kvlite.command.impl.key.TTLCommand;
import org.muma.kvlite.command.impl.key.TypeCommand;
import org.muma.kvlite.command.impl.list.LLenCommand;
import org.muma.kvlite.command.impl.list.LPushCommand;
import org.muma.kvlite.command.impl.list.LRangeCommand;
import org.muma.kvlite.command.impl.list.RPushCommand;
import org.muma.kvlite.command.impl.string.GetCommand;
import org.muma.kvlite.command.impl.string.SetCommand;
import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.ErrorMessage;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令执行入口：RedisMessage (命令) + StorageEngine -> RedisMessage (回复)
 * <p>
 * 所有用户层面的错误都以 ErrorMessage 返回，不会抛出异常。
 * 同一个 StorageEngine 不能被并发调用 execute。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long DEFAULT_SLOW_LOG_MILLIS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;
    private final long slowLogMillis;

    public CommandDispatcher(StorageEngine storage) {
        this(storage, DEFAULT_SLOW_LOG_MILLIS);
    }

    public CommandDispatcher(StorageEngine storage, long slowLogMillis) {
        this.storage = storage;
        this.slowLogMillis = slowLogMillis;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按类别注册
     */
    private void initCommandRegistry() {
        registerConnectionCommands();
        registerKeyCommands();
        registerStringCommands();
        registerListCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerConnectionCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
    }

    private void registerKeyCommands() {
        commandMap.put("DEL", new DelCommand());
        commandMap.put("EXISTS", new ExistsCommand());
        commandMap.put("TYPE", new TypeCommand());
        commandMap.put("TTL", new TTLCommand());
        commandMap.put("PTTL", new PTTLCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerListCommands() {
        commandMap.put("RPUSH", new RPushCommand());
        commandMap.put("LPUSH", new LPushCommand());
        commandMap.put("LRANGE", new LRangeCommand());
        commandMap.put("LLEN", new LLenCommand());
    }

    public RedisMessage execute(RedisMessage command) {
        return execute(command, storage);
    }

    /**
     * 核心分发逻辑
     * 命令表本身无状态，可以对不同的 StorageEngine 复用
     */
    public RedisMessage execute(RedisMessage command, StorageEngine storage) {
        // 1. 前置校验：非空数组，元素全部为 BulkString
        if (!(command instanceof RedisArray args)) {
            log.warn("Received non-array command: {}", command);
            return new ErrorMessage("ERR protocol error: expected array of bulk strings");
        }
        if (args.size() == 0) {
            return new ErrorMessage("ERR protocol error: empty command");
        }
        for (RedisMessage element : args.elements()) {
            if (!(element instanceof BulkString)) {
                log.warn("Received non-bulk command argument: {}", element);
                return new ErrorMessage("ERR protocol error: command name and arguments must be bulk strings");
            }
        }

        // 2. 查找命令
        String commandName = ((BulkString) args.elements()[0]).asString().toUpperCase(Locale.ROOT);
        RedisCommand redisCommand = commandMap.get(commandName);
        if (redisCommand == null) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage("Unknown command: " + commandName);
        }

        // 3. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = redisCommand.execute(storage, args);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > slowLogMillis) {
                log.warn("Slow command detected: {} cost {}ms", commandName, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", commandName, duration);
            }

            return response;

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误 (如参数错误、类型转换错误)
            log.warn("Command execution failed (Client Error): {} - {}", commandName, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", commandName, e);
            return new ErrorMessage("ERR internal server error");
        }
    }
}
