package work.lcod.bridge.handler;

public enum PipelineStage {
    IDLE,
    VALIDATING,
    DISPATCHING,
    AWAITING_SIDE_EFFECT,
    COMPLETED,
    FAILED
}
