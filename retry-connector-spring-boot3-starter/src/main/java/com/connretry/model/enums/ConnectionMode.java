package com.connretry.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * 连接校验模式
 */
@AllArgsConstructor
@Getter
public enum ConnectionMode {
    UNCHECKED("直接执行, 不做任何连通性校验"),
    CHECKED("执行前 ping, 断开则先重连"),
    FIXUP("先执行, 失败且连接已断开时重连再执行一次")
    ;

    public final String desc;

    /** YAML/字符串配置中大小写均可 */
    public static ConnectionMode from(String v) {
        return ConnectionMode.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
