package com.connretry.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 失败类型, 供重试判定器统一分支
 */
@AllArgsConstructor
@Getter
public enum FailureKind {
    OPERATION(false, "业务操作失败, 与连接无关"),
    TRANSIENT(false, "死锁/锁等待/超时等瞬时失败"),
    CONNECTION(false, "连接丢失或资源不可用"),
    TXN_ROLLBACK(true, "事务回滚本身失败"),
    SVP_ROLLBACK(true, "回滚到保存点失败")
    ;

    /** 是否为结构性失败（回滚过程出错） */
    public final boolean structural;
    public final String desc;
}
