package io.github.yok.sqlmodelrunner.resolve;

import io.github.yok.sqlmodelrunner.graph.ReferenceScanner;
import io.github.yok.sqlmodelrunner.model.Model;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Replaces reference tokens in a model body with fully-qualified identifiers.
 *
 * <p>
 * Substitution is textual: exactly the tokens reported by {@link ReferenceScanner} are replaced
 * (braces included) and every other character of the body is kept as is. Identifiers are not
 * quoted.
 * </p>
 *
 * <p>
 * A token the policy cannot resolve means the graph was not validated against the same policy.
 * That is a programming error, reported as {@link IllegalStateException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ReferenceResolver {

    /**
     * Resolves the body of a model.
     *
     * @param model model
     * @param policy naming policy
     * @return body with all tokens substituted
     * @throws IllegalStateException if a token cannot be resolved
     */
    public String resolve(Model model, NamingPolicy policy) {
        Validate.notNull(model, "model must not be null.");
        return resolve(model.getName(), model.getBody(), policy);
    }

    /**
     * Resolves a body.
     *
     * @param modelName owning model, for the error message
     * @param body model body
     * @param policy naming policy
     * @return body with all tokens substituted
     * @throws IllegalStateException if a token cannot be resolved
     */
    public String resolve(String modelName, String body, NamingPolicy policy) {
        Validate.notNull(body, "body must not be null.");
        Validate.notNull(policy, "policy must not be null.");

        List<ReferenceScanner.Token> tokens = ReferenceScanner.scan(body);
        if (tokens.isEmpty()) {
            return body;
        }

        StringBuilder sb = new StringBuilder(body.length() + tokens.size() * 16);
        int last = 0;
        for (ReferenceScanner.Token token : tokens) {
            String identifier = policy.resolve(token.getName())
                    .orElseThrow(() -> new IllegalStateException("Unresolved reference '{"
                            + token.getName() + "}' in model '" + modelName
                            + "' after graph validation"));
            sb.append(body, last, token.getStart()).append(identifier);
            last = token.getEnd();
        }
        sb.append(body, last, body.length());
        return sb.toString();
    }
}
