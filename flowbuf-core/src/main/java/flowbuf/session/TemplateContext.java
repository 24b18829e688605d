package flowbuf.session;

/**
 * Application data attached to an external template by a
 * {@link NewTemplateCallback}.
 */
public interface TemplateContext {

    /**
     * Called once, when the template is replaced, withdrawn, evicted with its
     * peer or when the session is closed.
     *
     * @param appContext the session's application context
     */
    default void release(Object appContext) {
    }

}
