package com.example.reliablemq.exception;

/**
 * 队列/交换机声明失败
 *
 * 典型场景：与已存在队列的参数不一致（PRECONDITION_FAILED）。
 * 缓解办法：关闭生产端声明，由消费端负责拓扑。
 */
public class DeclareException extends MessagingException {

    public DeclareException(String message, Throwable cause) {
        super(message, cause);
    }
}
