package typegraph.execution;

import typegraph.Internal;
import typegraph.language.Directive;
import typegraph.language.Field;
import typegraph.language.FragmentDefinition;
import typegraph.language.FragmentSpread;
import typegraph.language.InlineFragment;
import typegraph.language.Selection;
import typegraph.language.SelectionSet;
import typegraph.schema.Directives;
import typegraph.schema.GraphQLDirective;
import typegraph.schema.GraphQLObjectType;
import typegraph.schema.GraphQLType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A field collector can iterate over field selection sets and build out the sub fields that have been selected,
 * expanding named and inline fragments as it goes.
 * <p>
 * Fields are grouped by response key in the order the keys first appear. A fragment applies when its type condition
 * is the object type, an interface it implements or a union it belongs to.
 */
@Internal
public class FieldCollector {

    /**
     * Given a list of fields this will collect the sub-field selections and return it as a map
     *
     * @param parameters the parameters to this method
     * @param mergedFields the selected fields, all sharing one response key
     *
     * @return a map of the sub field selections
     */
    public Map<String, List<Field>> collectFields(FieldCollectorParameters parameters, List<Field> mergedFields) {
        Map<String, List<Field>> subFields = new LinkedHashMap<>();
        Set<String> visitedFragments = new HashSet<>();
        for (Field field : mergedFields) {
            if (field.getSelectionSet() == null) {
                continue;
            }
            this.collectFields(parameters, field.getSelectionSet(), visitedFragments, subFields);
        }
        return subFields;
    }

    /**
     * Given a selection set this will collect the sub-field selections and return it as a map
     *
     * @param parameters   the parameters to this method
     * @param selectionSet the selection set to collect on
     *
     * @return a map of the sub field selections
     */
    public Map<String, List<Field>> collectFields(FieldCollectorParameters parameters, SelectionSet selectionSet) {
        Map<String, List<Field>> subFields = new LinkedHashMap<>();
        Set<String> visitedFragments = new HashSet<>();
        this.collectFields(parameters, selectionSet, visitedFragments, subFields);
        return subFields;
    }

    private void collectFields(FieldCollectorParameters parameters, SelectionSet selectionSet, Set<String> visitedFragments, Map<String, List<Field>> fields) {
        for (Selection selection : selectionSet.getSelections()) {
            if (selection instanceof Field) {
                collectField(parameters, fields, (Field) selection);
            } else if (selection instanceof InlineFragment) {
                collectInlineFragment(parameters, visitedFragments, fields, (InlineFragment) selection);
            } else if (selection instanceof FragmentSpread) {
                collectFragmentSpread(parameters, visitedFragments, fields, (FragmentSpread) selection);
            }
        }
    }

    private void collectFragmentSpread(FieldCollectorParameters parameters, Set<String> visitedFragments, Map<String, List<Field>> fields, FragmentSpread fragmentSpread) {
        if (visitedFragments.contains(fragmentSpread.getName())) {
            return;
        }
        if (!shouldInclude(parameters, fragmentSpread.getDirectives())) {
            return;
        }
        visitedFragments.add(fragmentSpread.getName());
        FragmentDefinition fragmentDefinition = parameters.getFragmentsByName().get(fragmentSpread.getName());
        if (fragmentDefinition == null) {
            return;
        }
        if (!doesFragmentConditionMatch(parameters, fragmentDefinition.getTypeCondition())) {
            return;
        }
        collectFields(parameters, fragmentDefinition.getSelectionSet(), visitedFragments, fields);
    }

    private void collectInlineFragment(FieldCollectorParameters parameters, Set<String> visitedFragments, Map<String, List<Field>> fields, InlineFragment inlineFragment) {
        if (!shouldInclude(parameters, inlineFragment.getDirectives()) ||
                !doesFragmentConditionMatch(parameters, inlineFragment.getTypeCondition())) {
            return;
        }
        collectFields(parameters, inlineFragment.getSelectionSet(), visitedFragments, fields);
    }

    private void collectField(FieldCollectorParameters parameters, Map<String, List<Field>> fields, Field field) {
        if (!shouldInclude(parameters, field.getDirectives())) {
            return;
        }
        fields.computeIfAbsent(field.getResultKey(), k -> new ArrayList<>()).add(field);
    }

    private boolean shouldInclude(FieldCollectorParameters parameters, List<Directive> directives) {
        if (isConditionMet(parameters, directives, Directives.SkipDirective)) {
            return false;
        }
        Directive include = findDirective(directives, Directives.IncludeDirective.getName());
        return include == null || isConditionMet(parameters, directives, Directives.IncludeDirective);
    }

    private boolean isConditionMet(FieldCollectorParameters parameters, List<Directive> directives, GraphQLDirective directiveDefinition) {
        Directive directive = findDirective(directives, directiveDefinition.getName());
        if (directive == null) {
            return false;
        }
        Map<String, Object> argumentValues = parameters.getValuesResolver().getArgumentValues(directiveDefinition.getArguments(), directive.getArguments(), parameters.getVariables());
        return Boolean.TRUE.equals(argumentValues.get("if"));
    }

    private static Directive findDirective(List<Directive> directives, String name) {
        for (Directive directive : directives) {
            if (directive.getName().equals(name)) {
                return directive;
            }
        }
        return null;
    }

    private boolean doesFragmentConditionMatch(FieldCollectorParameters parameters, String typeCondition) {
        if (typeCondition == null) {
            return true;
        }
        GraphQLObjectType objectType = parameters.getObjectType();
        if (typeCondition.equals(objectType.getName())) {
            return true;
        }
        GraphQLType conditionType = parameters.getGraphQLSchema().getType(typeCondition);
        if (conditionType == null || !conditionType.getKind().isAbstract()) {
            return false;
        }
        return parameters.getGraphQLSchema().isPossibleType(conditionType, objectType);
    }
}
