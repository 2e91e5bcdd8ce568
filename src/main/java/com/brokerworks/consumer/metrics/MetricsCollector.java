// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.brokerworks.consumer.metrics;

/** Interface to collect execution data of the consumers. */
public interface MetricsCollector {

  /** Called when a consumer connection and subscription are created. */
  void openConsumer();

  /** Called when a consumer connection and subscription are disposed. */
  void closeConsumer();

  /** Called when a {@link com.brokerworks.consumer.Message} is received. */
  void consume();

  /**
   * Called when a {@link com.brokerworks.consumer.Message} is settled by a consumer.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** Called when the message handler fails. */
  void handlerFailure();

  /** Called when the supervising loop waits before retrying after a failure. */
  void recover();

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** see {@link com.brokerworks.consumer.DeliveryOutcome#ACCEPT} */
    ACCEPTED,
    /** see {@link com.brokerworks.consumer.DeliveryOutcome#REJECT} */
    REJECTED,
    /** see {@link com.brokerworks.consumer.DeliveryOutcome#RELEASE} */
    RELEASED,
    /** see {@link com.brokerworks.consumer.DeliveryOutcome#RETRY} */
    RETRIED
  }
}
