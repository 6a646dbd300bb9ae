package com.cgi.dbsurveyor.collector.adapter.mongodb;

import com.cgi.dbsurveyor.collector.service.sampling.SampleValueConverter;
import org.bson.BsonTimestamp;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

/**
 * Adds BSON value types to the JSON-safe conversion.
 */
class BsonValueConverter extends SampleValueConverter {

    @Override
    protected Object convertOther(Object value) {
        if (value instanceof ObjectId) {
            return ((ObjectId) value).toHexString();
        }
        if (value instanceof Binary) {
            return encodeBinary(((Binary) value).getData());
        }
        if (value instanceof Decimal128) {
            Decimal128 decimal = (Decimal128) value;
            return decimal.isNaN() || decimal.isInfinite() ? decimal.toString() : decimal.bigDecimalValue();
        }
        if (value instanceof BsonTimestamp) {
            BsonTimestamp timestamp = (BsonTimestamp) value;
            return timestamp.getTime() + ":" + timestamp.getInc();
        }
        return super.convertOther(value);
    }
}
