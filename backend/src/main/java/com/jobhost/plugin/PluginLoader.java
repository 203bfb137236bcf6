package com.jobhost.plugin;

import com.jobhost.api.ScheduledJob;

/**
 * Loads job artifacts into disposable, isolated contexts. A context serves exactly one firing
 * and must be closed on every exit path.
 */
public interface PluginLoader {

    PluginContext openContext();

    /**
     * Loads the unit into the context and returns its single concrete {@link ScheduledJob} type.
     *
     * @throws com.jobhost.exception.NoEntryTypeFoundException if the main jar has no such type
     * @throws com.jobhost.exception.ArtifactLoadException if the jar cannot be read
     */
    Class<? extends ScheduledJob> load(PluginContext context, LoadableUnit unit);

    /**
     * @throws com.jobhost.exception.EntryInstantiationException if construction fails
     */
    ScheduledJob instantiate(Class<? extends ScheduledJob> entryType);

    /** Releases everything loaded by the context. Safe to call more than once. */
    void closeContext(PluginContext context);
}
