package flowbuf.session;

import flowbuf.template.Template;

@FunctionalInterface
public interface NewTemplateCallback {

    /**
     * Invoked synchronously the first time an external template is known under
     * a template id, from a template set or from an explicit registration.
     * Pairing can be set up from here.
     *
     * @return a context kept with the template, may be null
     */
    TemplateContext newTemplate(Session session, int templateId, Template template, Object appContext);

}
