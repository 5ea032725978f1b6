package com.sharedsource.webapi.query;

/**
 * Query carrying item field values for create and update calls.
 */
public interface UpdatableQuery extends BaseQuery {

    /**
     * Gets fields to write.
     *
     * @return FieldMap instance.
     */
    FieldMap getFieldsToUpdate();
}
