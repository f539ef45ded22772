package com.seequence.api.service.pipeline;

/**
 * 스트리밍 이벤트 수신자
 * 예외를 던지면 클라이언트 연결이 끊긴 것으로 보고 실행을 중단한다.
 */
@FunctionalInterface
public interface PipelineEventListener {

    void onEvent(PipelineEvent event);
}
