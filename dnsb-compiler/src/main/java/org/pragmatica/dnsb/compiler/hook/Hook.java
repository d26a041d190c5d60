package org.pragmatica.dnsb.compiler.hook;

import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;

/**
 * User extension point.
 *
 * <p>A hook sees one service subtree at a time. {@link HookStage#SETUP} and
 * {@link HookStage#MODIFY} hooks return the replacement subtree; {@link HookStage#VALIDATE} hooks
 * return a verdict. A failed result aborts the compile run.
 *
 * <p>Hooks are selected by {@link #name()} from the {@code auto} mapping of the project or of a
 * service, for example {@code auto: {modify: [my-hook]}}. Implementations may run concurrently for
 * different services and must not keep per-call state.
 */
public interface Hook {
    String name();

    default Result<Mapping> transform(HookStage stage, String service, Mapping subtree, HookCapabilities capabilities) {
        return Result.success(subtree);
    }

    default Result<HookVerdict> validate(String service, Mapping subtree, HookCapabilities capabilities) {
        return Result.success(HookVerdict.accept());
    }
}
