package ai.querygraph.classify;

import java.util.HashMap;
import java.util.Map;

import ai.querygraph.model.NormalizedKey;
import ai.querygraph.model.Resolution;

/**
 * Names recognized in one file, each with the certainty it was recognized with.
 * Filled by {@link ImportScanner} and {@link LocalBindingScanner}, read by {@link CallSiteClassifier}.
 */
final class ParseContext {

    final Map<String, Resolution> queryHooks = new HashMap<>();
    /** Local hook name to the library hook it aliases. */
    final Map<String, String> queryHookKinds = new HashMap<>();
    final Map<String, Resolution> queryNamespaces = new HashMap<>();
    final Map<String, Resolution> useQueryClientNames = new HashMap<>();
    final Map<String, Resolution> queryClientCtorNames = new HashMap<>();
    final Map<String, Resolution> queryClientTypeNames = new HashMap<>();
    final Map<String, Resolution> queryClientVars = new HashMap<>();

    /** {@code const { refetch: r } = useQuery(...)}: r to the hook's key. */
    final Map<String, NormalizedKey> refetchFunctions = new HashMap<>();
    /** {@code const q = useQuery(...)}: q to the hook's key. */
    final Map<String, NormalizedKey> refetchObjects = new HashMap<>();

    /** Records a certainty; a static entry is never downgraded. */
    static void setCertainty(Map<String, Resolution> map, String name, Resolution certainty) {
        final Resolution current = map.get(name);
        if (current == Resolution.STATIC) {
            return;
        }
        if (current == null || certainty == Resolution.STATIC) {
            map.put(name, certainty);
        }
    }
}
