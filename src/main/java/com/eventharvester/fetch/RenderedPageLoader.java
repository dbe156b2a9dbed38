package com.eventharvester.fetch;

/**
 * Loader for pages whose listing only exists after client-side scripts have run.
 * Sources of the script-rendered shape are skipped when no such bean is present.
 */
public interface RenderedPageLoader extends PageLoader {
}
