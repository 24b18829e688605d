package flowbuf.session;

import flowbuf.template.Template;

/**
 * The outcome of a template resolution. A null internal template means that
 * records using the external template are not to be decoded.
 */
public record TemplatePair(int externalId, Template external, int internalId, Template internal) {

    public boolean isSkip() {
        return internal == null;
    }

}
