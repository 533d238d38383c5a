package com.example.reliablemq.consumer;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.springframework.amqp.core.ExchangeTypes;

import com.example.reliablemq.constant.MessagingConstants.QueueArguments;
import com.example.reliablemq.constant.MessagingConstants.Topology;
import com.rabbitmq.client.Channel;

/**
 * 死信队列拓扑
 *
 * <pre>
 * 原队列 --(nack, requeue=false)--> &lt;queue&gt;.failed.dlx --(&lt;queue&gt;.failed)--> &lt;queue&gt;.failed
 * </pre>
 * 死信队列不带任何参数，消息永久保留供人工排查。
 */
final class DeadLetterQueueSetup {

    private DeadLetterQueueSetup() {
    }

    /**
     * 声明 DLX、DLQ 并绑定
     *
     * @return 需要合并进原队列声明的死信参数（死信参数在声明时确定，之后无法修改）
     */
    static Map<String, Object> declare(Channel channel, String originalQueue) throws IOException {
        String dlxName = Topology.deadLetterExchange(originalQueue);
        String dlqName = Topology.deadLetterQueue(originalQueue);

        channel.exchangeDeclare(dlxName, ExchangeTypes.DIRECT, true, false, false, null);
        channel.queueDeclare(dlqName, true, false, false, null);
        channel.queueBind(dlqName, dlxName, dlqName);

        Map<String, Object> args = new HashMap<>();
        args.put(QueueArguments.DEAD_LETTER_EXCHANGE, dlxName);
        args.put(QueueArguments.DEAD_LETTER_ROUTING_KEY, dlqName);
        return args;
    }
}
