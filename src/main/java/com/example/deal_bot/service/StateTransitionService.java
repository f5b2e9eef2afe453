package com.example.deal_bot.service;

import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.example.deal_bot.entity.StateTransition;
import com.example.deal_bot.repo.StateTransitionRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class StateTransitionService {

    public static final String TYPE_DEAL = "DEAL";
    public static final String TYPE_SYSTEM = "SYSTEM";

    private final StateTransitionRepository repo;

    public void log(
            String entityType,
            String entityRef,
            String fromState,
            String toState,
            String reasonCode,
            String reasonDetail,
            String actor,
            String correlationId
    ) {
        StateTransition st = new StateTransition();
        st.setEntityType(entityType);
        st.setEntityRef(entityRef == null ? "0" : entityRef);
        st.setFromState(fromState);
        st.setToState(toState);
        st.setReasonCode(reasonCode);
        st.setReasonDetail(truncate(reasonDetail, 1000));
        st.setActor(actor == null || actor.isBlank() ? "SYSTEM" : actor);
        st.setCorrelationId(correlationId == null ? newCorrelationId() : correlationId);
        st.setCreatedAt(LocalDateTime.now());
        repo.save(st);
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }
}
