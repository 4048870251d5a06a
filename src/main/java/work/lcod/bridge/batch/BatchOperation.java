package work.lcod.bridge.batch;

import java.util.Map;

@FunctionalInterface
public interface BatchOperation {
    Map<String, Object> apply(Object target) throws Exception;
}
