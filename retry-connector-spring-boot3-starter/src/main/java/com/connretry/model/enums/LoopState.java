package com.connretry.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 重试循环状态
 */
@AllArgsConstructor
@Getter
public enum LoopState {
    RUNNING(false, "执行中"),
    RETRYING(false, "本次失败, 准备下一次尝试"),
    SUCCESS(true, "执行成功，终态"),
    FATAL(true, "达到上限或被判定不重试，终态")
    ;

    public final boolean terminal;
    public final String desc;
}
