package com.admissioncontrol.queue;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueueStatus {
    String queueName;
    long queued;
    long processing;
    long completed;
    long failed;
    boolean running;
}
