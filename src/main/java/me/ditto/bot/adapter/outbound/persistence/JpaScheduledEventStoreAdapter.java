package me.ditto.bot.adapter.outbound.persistence;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.ditto.bot.domain.model.ScheduledEvent;
import me.ditto.bot.port.outbound.ScheduledEventStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * {@link ScheduledEventStore} backed by the {@code scheduled_events} table.
 *
 * <p>
 * Inserts and deletes run in their own transaction so that they are committed
 * before the scheduler signals its loop or dispatches an event, even when the
 * caller already has a transaction open.
 */
@Component
@Slf4j
public class JpaScheduledEventStoreAdapter implements ScheduledEventStore {

    private final ScheduledEventRepository repository;
    private final ScheduledEventPayloadCodec payloadCodec;
    private final TransactionTemplate requiresNew;

    public JpaScheduledEventStoreAdapter(ScheduledEventRepository repository,
            ScheduledEventPayloadCodec payloadCodec,
            PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.payloadCodec = payloadCodec;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public long insert(ScheduledEvent event) {
        ScheduledEventEntity entity = new ScheduledEventEntity();
        entity.setCreatedAt(event.getCreatedAt());
        entity.setScheduledFor(event.getScheduledFor());
        entity.setEventType(event.getEventType());
        entity.setPayload(payloadCodec.encode(event.getArgs(), event.getKwargs()));

        Long id = StoreFailures.translate("insert",
                () -> requiresNew.execute(status -> repository.save(entity).getId()));
        if (id == null) {
            throw new IllegalStateException("Store did not assign an id to scheduled event");
        }
        return id;
    }

    @Override
    public Optional<ScheduledEvent> fetchSoonest() {
        return StoreFailures.translate("fetch",
                () -> repository.findFirstByOrderByScheduledForAscIdAsc().map(this::toDomain));
    }

    @Override
    public void delete(long id) {
        StoreFailures.run("delete", () -> requiresNew.executeWithoutResult(status -> repository.deleteById(id)));
    }

    @Override
    public long count() {
        return StoreFailures.translate("count", repository::count);
    }

    private ScheduledEvent toDomain(ScheduledEventEntity entity) {
        ScheduledEventPayloadCodec.Payload payload = payloadCodec.decode(entity.getPayload());
        return ScheduledEvent.builder()
                .id(entity.getId())
                .createdAt(entity.getCreatedAt())
                .scheduledFor(entity.getScheduledFor())
                .eventType(entity.getEventType())
                .args(payload.args())
                .kwargs(payload.kwargs())
                .build();
    }
}
