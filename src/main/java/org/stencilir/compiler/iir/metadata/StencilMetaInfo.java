package org.stencilir.compiler.iir.metadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencilir.compiler.api.GlobalValue;
import org.stencilir.compiler.api.InvariantViolationException;
import org.stencilir.compiler.api.IrErrorCode;
import org.stencilir.compiler.api.LookupFailureException;
import org.stencilir.compiler.api.SourceLocation;
import org.stencilir.compiler.ast.BoundaryConditionDeclStmt;
import org.stencilir.compiler.ast.StencilCallDeclStmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The symbol table of one stencil instantiation.
 * <p>
 * Every field, local variable and global variable the lowered stencil touches has a positive
 * AccessID bound to a unique name. Literals get negative AccessIDs from a separate counter and are
 * kept in their own table, so their text may repeat. Classification sets (fields, API fields,
 * temporaries, globals) refer to these IDs.
 * <p>
 * The ID counters are not persisted: they are re-seeded from the largest ID present whenever an
 * ID is registered, so an instance restored from its wire form keeps allocating fresh IDs.
 */
public class StencilMetaInfo {

    private static final Logger LOG = LoggerFactory.getLogger(StencilMetaInfo.class);

    private final SortedMap<Integer, String> accessIdToName = new TreeMap<>();
    private final Map<String, Integer> nameToAccessId = new HashMap<>();
    private final SortedMap<Integer, String> literalIdToName = new TreeMap<>();

    private final SortedSet<Integer> fieldIds = new TreeSet<>();
    private final Set<Integer> apiFieldIds = new LinkedHashSet<>();
    private final SortedSet<Integer> temporaryFieldIds = new TreeSet<>();
    private final SortedSet<Integer> globalVariableIds = new TreeSet<>();

    private VariableVersions variableVersions = new VariableVersions();
    private final List<StencilDescStatement> stencilDescStatements = new ArrayList<>();
    private final SortedMap<Integer, StencilCallDeclStmt> idToStencilCall = new TreeMap<>();
    private final SortedMap<String, BoundaryConditionDeclStmt> fieldNameToBoundaryCondition = new TreeMap<>();
    private final SortedMap<Integer, LegalDimensions> fieldIdToLegalDimensions = new TreeMap<>();
    private final SortedMap<String, GlobalValue> globalVariableValues = new TreeMap<>();

    private String stencilName = "";
    private SourceLocation stencilLocation = SourceLocation.UNKNOWN;
    private String fileName = "";

    private int nextAccessId = 1;
    private int nextLiteralId = -1;

    // region ID registration

    /**
     * Registers an API field, i.e. a field argument of the stencil. API fields keep their
     * registration order.
     * @param name The field name.
     * @return The new AccessID.
     */
    public int registerApiField(String name) {
        int id = registerName(name);
        fieldIds.add(id);
        apiFieldIds.add(id);
        return id;
    }

    /**
     * Registers a temporary field of the stencil.
     * @param name The field name.
     * @return The new AccessID.
     */
    public int registerTemporaryField(String name) {
        int id = registerName(name);
        fieldIds.add(id);
        temporaryFieldIds.add(id);
        return id;
    }

    /**
     * Registers a local variable.
     * @param name The variable name, unique within this instantiation.
     * @return The new AccessID.
     */
    public int registerVariable(String name) {
        return registerName(name);
    }

    /**
     * Registers a global variable accessed by the stencil.
     * @param name The global's name.
     * @return The new AccessID.
     */
    public int registerGlobalVariable(String name) {
        int id = registerName(name);
        globalVariableIds.add(id);
        return id;
    }

    /**
     * Registers a literal. Every occurrence gets its own ID, even if the text repeats.
     * @param value The literal text.
     * @return The new, negative AccessID.
     */
    public int registerLiteral(String value) {
        int id = nextLiteralId;
        addLiteral(id, value);
        return id;
    }

    /**
     * Binds a given AccessID to a name.
     * @param id The positive AccessID.
     * @param name The name.
     * @throws InvariantViolationException if the ID or the name is already bound.
     */
    public void addAccessIdName(int id, String name) {
        Objects.requireNonNull(name, "name");
        if (id <= 0) {
            throw new IllegalArgumentException("AccessIDs of named entities are positive, got " + id);
        }
        if (accessIdToName.containsKey(id)) {
            throw new InvariantViolationException(IrErrorCode.DUPLICATE_NAME,
                    "AccessID " + id + " is already bound to '" + accessIdToName.get(id) + "'");
        }
        Integer existing = nameToAccessId.get(name);
        if (existing != null) {
            throw new InvariantViolationException(IrErrorCode.DUPLICATE_NAME,
                    "Name '" + name + "' is already bound to AccessID " + existing);
        }
        accessIdToName.put(id, name);
        nameToAccessId.put(name, id);
        nextAccessId = Math.max(nextAccessId, id + 1);
    }

    /**
     * Restores a binding read from an encoded instantiation. Unlike {@link #addAccessIdName(int, String)}
     * a name may be bound to several AccessIDs; lookups by name then return the smallest, and
     * {@link #getNameClashes()} reports the clash.
     * @param id The positive AccessID.
     * @param name The name.
     */
    public void restoreAccessIdName(int id, String name) {
        Objects.requireNonNull(name, "name");
        if (id <= 0) {
            throw new IllegalArgumentException("AccessIDs of named entities are positive, got " + id);
        }
        Integer existing = nameToAccessId.get(name);
        if (existing != null && existing != id) {
            LOG.warn("Name '{}' is bound to both AccessID {} and AccessID {}", name, Math.min(existing, id), Math.max(existing, id));
        }
        accessIdToName.put(id, name);
        nameToAccessId.merge(name, id, Integer::min);
        nextAccessId = Math.max(nextAccessId, id + 1);
    }

    /**
     * Binds a given literal AccessID to its text.
     * @param id The negative AccessID.
     * @param value The literal text.
     */
    public void addLiteral(int id, String value) {
        Objects.requireNonNull(value, "value");
        if (id >= 0) {
            throw new IllegalArgumentException("Literal AccessIDs are negative, got " + id);
        }
        if (literalIdToName.containsKey(id)) {
            throw new InvariantViolationException(IrErrorCode.DUPLICATE_NAME, "Literal AccessID " + id + " is already bound");
        }
        literalIdToName.put(id, value);
        nextLiteralId = Math.min(nextLiteralId, id - 1);
    }

    /** Marks an AccessID as a field. */
    public void addFieldId(int id) {
        fieldIds.add(id);
        bumpCounter(id);
    }

    /** Appends an AccessID to the ordered API fields. */
    public void addApiFieldId(int id) {
        apiFieldIds.add(id);
        bumpCounter(id);
    }

    /** Marks an AccessID as a temporary field. */
    public void addTemporaryFieldId(int id) {
        temporaryFieldIds.add(id);
        bumpCounter(id);
    }

    /** Marks an AccessID as a global variable. */
    public void addGlobalVariableId(int id) {
        globalVariableIds.add(id);
        bumpCounter(id);
    }

    private int registerName(String name) {
        int id = nextAccessId;
        addAccessIdName(id, name);
        return id;
    }

    private void bumpCounter(int id) {
        if (id > 0) {
            nextAccessId = Math.max(nextAccessId, id + 1);
        }
    }

    // endregion

    // region Lookups

    /**
     * @param id A named or literal AccessID.
     * @return The name, or the literal text for a negative ID.
     * @throws LookupFailureException if the ID is not registered.
     */
    public String getNameFromAccessId(int id) {
        return findNameFromAccessId(id).orElseThrow(() -> new LookupFailureException(IrErrorCode.UNKNOWN_ACCESS_ID,
                "No name registered for AccessID " + id));
    }

    public Optional<String> findNameFromAccessId(int id) {
        return Optional.ofNullable(id < 0 ? literalIdToName.get(id) : accessIdToName.get(id));
    }

    /**
     * @param name A field, variable or global name.
     * @return Its AccessID.
     * @throws LookupFailureException if the name is not registered.
     */
    public int getAccessIdFromName(String name) {
        return findAccessIdFromName(name).orElseThrow(() -> new LookupFailureException(IrErrorCode.UNKNOWN_ACCESS_ID,
                "No AccessID registered for '" + name + "'"));
    }

    public Optional<Integer> findAccessIdFromName(String name) {
        return Optional.ofNullable(nameToAccessId.get(name));
    }

    public boolean hasName(String name) {
        return nameToAccessId.containsKey(name);
    }

    public boolean isField(int id) {
        return fieldIds.contains(id);
    }

    public boolean isApiField(int id) {
        return apiFieldIds.contains(id);
    }

    public boolean isTemporaryField(int id) {
        return temporaryFieldIds.contains(id);
    }

    public boolean isGlobalVariable(int id) {
        return globalVariableIds.contains(id);
    }

    public boolean isLiteral(int id) {
        return literalIdToName.containsKey(id);
    }

    /**
     * @param id An AccessID.
     * @return {@code true} if the ID names a local variable: registered, but neither field, global nor literal.
     */
    public boolean isVariable(int id) {
        return accessIdToName.containsKey(id) && !isField(id) && !isGlobalVariable(id);
    }

    /**
     * @return Every name bound to more than one AccessID, with those IDs in ascending order.
     */
    public Map<String, List<Integer>> getNameClashes() {
        SortedMap<String, List<Integer>> idsByName = new TreeMap<>();
        accessIdToName.forEach((id, name) -> idsByName.computeIfAbsent(name, n -> new ArrayList<>()).add(id));
        idsByName.values().removeIf(ids -> ids.size() < 2);
        return idsByName;
    }

    public Map<Integer, String> getAccessIdToName() {
        return Collections.unmodifiableSortedMap(accessIdToName);
    }

    public Map<Integer, String> getLiteralIdToName() {
        return Collections.unmodifiableSortedMap(literalIdToName);
    }

    public Set<Integer> getFieldIds() {
        return Collections.unmodifiableSortedSet(fieldIds);
    }

    /**
     * @return The API field IDs in the order of the stencil's arguments.
     */
    public List<Integer> getApiFieldIds() {
        return List.copyOf(apiFieldIds);
    }

    public Set<Integer> getTemporaryFieldIds() {
        return Collections.unmodifiableSortedSet(temporaryFieldIds);
    }

    public Set<Integer> getGlobalVariableIds() {
        return Collections.unmodifiableSortedSet(globalVariableIds);
    }

    // endregion

    // region Versioning

    public VariableVersions getVariableVersions() {
        return variableVersions;
    }

    /**
     * Replaces the version tables, e.g. with ones restored from the wire form.
     * @param variableVersions The tables.
     */
    public void setVariableVersions(VariableVersions variableVersions) {
        this.variableVersions = Objects.requireNonNull(variableVersions, "variableVersions");
        int maxId = variableVersions.maxId();
        if (maxId > 0) {
            nextAccessId = Math.max(nextAccessId, maxId + 1);
        }
    }

    /**
     * Creates a new version of a field or variable. The version is named {@code <name>_<n>}, with
     * {@code n} the 1-based version count, and is classified like its original: a version of a
     * field is a temporary field, a version of a variable a variable.
     *
     * @param originalId The AccessID to version, or one of its versions.
     * @return The AccessID of the new version.
     * @throws LookupFailureException if the original has no name.
     */
    public int createVersion(int originalId) {
        int root = variableVersions.findOriginalOf(originalId).orElse(originalId);
        String rootName = getNameFromAccessId(root);
        int n = variableVersions.isVersioned(root) ? variableVersions.versionsOf(root).size() + 1 : 1;
        String name = rootName + "_" + n;
        while (hasName(name)) {
            name = rootName + "_" + (++n);
        }
        int version = isField(root) ? registerTemporaryField(name) : registerVariable(name);
        variableVersions.addVersion(root, version);
        return version;
    }

    // endregion

    // region Statements

    public List<StencilDescStatement> getStencilDescStatements() {
        return Collections.unmodifiableList(stencilDescStatements);
    }

    public void addStencilDescStatement(StencilDescStatement statement) {
        stencilDescStatements.add(Objects.requireNonNull(statement, "statement"));
    }

    public void insertStencilDescStatement(int index, StencilDescStatement statement) {
        stencilDescStatements.add(index, Objects.requireNonNull(statement, "statement"));
    }

    public StencilDescStatement removeStencilDescStatement(int index) {
        return stencilDescStatements.remove(index);
    }

    /**
     * Records the call statement that invokes a lowered stencil.
     * @param stencilId The ID of the IIR stencil.
     * @param call The call statement.
     */
    public void addStencilCall(int stencilId, StencilCallDeclStmt call) {
        idToStencilCall.put(stencilId, Objects.requireNonNull(call, "call"));
    }

    /**
     * @param stencilId The ID of an IIR stencil.
     * @return The statement calling it.
     * @throws LookupFailureException if no call is registered.
     */
    public StencilCallDeclStmt getStencilCall(int stencilId) {
        StencilCallDeclStmt call = idToStencilCall.get(stencilId);
        if (call == null) {
            throw new LookupFailureException(IrErrorCode.UNKNOWN_STENCIL, "No call registered for stencil " + stencilId);
        }
        return call;
    }

    public Map<Integer, StencilCallDeclStmt> getStencilCalls() {
        return Collections.unmodifiableSortedMap(idToStencilCall);
    }

    public void addBoundaryCondition(String fieldName, BoundaryConditionDeclStmt condition) {
        fieldNameToBoundaryCondition.put(Objects.requireNonNull(fieldName, "fieldName"),
                Objects.requireNonNull(condition, "condition"));
    }

    public Optional<BoundaryConditionDeclStmt> findBoundaryCondition(String fieldName) {
        return Optional.ofNullable(fieldNameToBoundaryCondition.get(fieldName));
    }

    public Map<String, BoundaryConditionDeclStmt> getBoundaryConditions() {
        return Collections.unmodifiableSortedMap(fieldNameToBoundaryCondition);
    }

    // endregion

    // region Fields and globals

    public void setLegalDimensions(int fieldId, LegalDimensions dimensions) {
        fieldIdToLegalDimensions.put(fieldId, Objects.requireNonNull(dimensions, "dimensions"));
    }

    /**
     * @param fieldId A field's AccessID.
     * @return The dimensions the field is declared over.
     * @throws LookupFailureException if none were recorded.
     */
    public LegalDimensions getLegalDimensions(int fieldId) {
        LegalDimensions dimensions = fieldIdToLegalDimensions.get(fieldId);
        if (dimensions == null) {
            throw new LookupFailureException(IrErrorCode.UNKNOWN_FIELD, "No legal dimensions recorded for field " + fieldId);
        }
        return dimensions;
    }

    /**
     * @param fieldName A field's name.
     * @return The dimensions the field is declared over, if known.
     */
    public Optional<LegalDimensions> findLegalDimensions(String fieldName) {
        return findAccessIdFromName(fieldName).map(fieldIdToLegalDimensions::get);
    }

    public Map<Integer, LegalDimensions> getLegalDimensions() {
        return Collections.unmodifiableSortedMap(fieldIdToLegalDimensions);
    }

    public void setGlobalValue(String name, GlobalValue value) {
        globalVariableValues.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    }

    /**
     * @param name A global's name.
     * @return Its typed value, possibly unset.
     * @throws LookupFailureException if the global is unknown.
     */
    public GlobalValue getGlobalValue(String name) {
        return findGlobalValue(name).orElseThrow(() -> new LookupFailureException(IrErrorCode.UNKNOWN_GLOBAL,
                "No global variable named '" + name + "'"));
    }

    public Optional<GlobalValue> findGlobalValue(String name) {
        return Optional.ofNullable(globalVariableValues.get(name));
    }

    /**
     * @param name A global's name.
     * @return {@code true} if the global has a value, {@code false} if it is declared without one.
     * @throws LookupFailureException if the global is unknown.
     */
    public boolean isGlobalSet(String name) {
        return getGlobalValue(name).isSet();
    }

    public Map<String, GlobalValue> getGlobalValues() {
        return Collections.unmodifiableSortedMap(globalVariableValues);
    }

    // endregion

    public String getStencilName() {
        return stencilName;
    }

    public void setStencilName(String stencilName) {
        this.stencilName = Objects.requireNonNull(stencilName, "stencilName");
    }

    public SourceLocation getStencilLocation() {
        return stencilLocation;
    }

    public void setStencilLocation(SourceLocation stencilLocation) {
        this.stencilLocation = Objects.requireNonNull(stencilLocation, "stencilLocation");
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StencilMetaInfo that)) return false;
        return accessIdToName.equals(that.accessIdToName)
                && literalIdToName.equals(that.literalIdToName)
                && fieldIds.equals(that.fieldIds)
                && getApiFieldIds().equals(that.getApiFieldIds())
                && temporaryFieldIds.equals(that.temporaryFieldIds)
                && globalVariableIds.equals(that.globalVariableIds)
                && variableVersions.equals(that.variableVersions)
                && stencilDescStatements.equals(that.stencilDescStatements)
                && idToStencilCall.equals(that.idToStencilCall)
                && fieldNameToBoundaryCondition.equals(that.fieldNameToBoundaryCondition)
                && fieldIdToLegalDimensions.equals(that.fieldIdToLegalDimensions)
                && globalVariableValues.equals(that.globalVariableValues)
                && stencilName.equals(that.stencilName)
                && fileName.equals(that.fileName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessIdToName, literalIdToName, fieldIds, getApiFieldIds(), temporaryFieldIds,
                globalVariableIds, variableVersions, stencilDescStatements, idToStencilCall,
                fieldNameToBoundaryCondition, fieldIdToLegalDimensions, globalVariableValues, stencilName, fileName);
    }

    @Override
    public String toString() {
        return "StencilMetaInfo{" + stencilName + ", ids=" + accessIdToName + ", literals=" + literalIdToName + '}';
    }
}
