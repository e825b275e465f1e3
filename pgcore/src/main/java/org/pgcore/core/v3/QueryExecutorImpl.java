/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.v3;

import org.pgcore.PGProperty;
import org.pgcore.core.Field;
import org.pgcore.core.Format;
import org.pgcore.core.MessageFramer;
import org.pgcore.core.MessageHandler;
import org.pgcore.core.MessageReader;
import org.pgcore.core.NoticeListener;
import org.pgcore.core.Notification;
import org.pgcore.core.NotificationListener;
import org.pgcore.core.Oid;
import org.pgcore.core.Result;
import org.pgcore.core.ResultHandler;
import org.pgcore.core.TransactionState;
import org.pgcore.core.types.ConverterPair;
import org.pgcore.core.types.DecodeContext;
import org.pgcore.core.types.ParameterEncoder;
import org.pgcore.core.types.ParameterInfo;
import org.pgcore.core.types.TextConverters;
import org.pgcore.core.types.TypeConverter;
import org.pgcore.core.types.TypeRegistry;
import org.pgcore.log.Log;
import org.pgcore.log.Logger;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;
import org.pgcore.util.ServerErrorMessage;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Protocol v3 state machine of one connection. {@link #execute} builds the bytes of a request;
 * the backend's answer is fed through {@link #getBuffer()} and {@link #bufferUpdated(int)}, and
 * each request ends with exactly one call of the {@link ResultHandler} on ReadyForQuery.
 *
 * <p>Performs no I/O and is not thread safe: one request may be in flight at a time.</p>
 */
public class QueryExecutorImpl implements MessageHandler, DecodeContext {

  private static Log LOGGER = Logger.getLogger(QueryExecutorImpl.class.getName());

  /**
   * Passes on messages this executor has no handling for; rejects them by default.
   */
  public static final MessageHandler UNEXPECTED_MESSAGE_HANDLER = (tag, body) -> {
    throw new PSQLException(GT.tr("Unexpected packet type: {0}", (int) tag), PSQLState.PROTOCOL_VIOLATION);
  };

  private final Properties info;
  private final ResultHandler resultHandler;
  private final MessageFramer framer;
  private final StatementCache statementCache;
  private final Map<Integer, ConverterPair> customConverters = new HashMap<Integer, ConverterPair>();
  private final Map<String, String> parameterStatuses = new LinkedHashMap<String, String>();

  private MessageHandler fallbackHandler = UNEXPECTED_MESSAGE_HANDLER;
  private NoticeListener noticeListener;
  private NotificationListener notificationListener;

  private TransactionState transactionState = TransactionState.IDLE;
  private boolean isoDates = true;
  private ZoneId timeZone;
  private String intervalStyle = "postgres";
  private boolean standardConformingStrings = true;
  private int backendPid;
  private int backendSecretKey;
  private boolean closed;

  // state of the request in flight
  private boolean cycleActive;
  private StatementKey cycleKey;
  private CachedStatement cycleEntry;
  private boolean cycleWasPrepared;
  private boolean namedParsePending;
  private Format cycleFormat = Format.TEXT;
  private boolean cycleRaw;
  private OutputStream cycleSink;
  private boolean copyOutActive;
  private boolean copyOutFailed;
  private List<Field> currentFields;
  private TypeConverter[] currentConverters;
  private List<Object[]> currentRows;
  private List<Result> results = new ArrayList<Result>();
  private SQLException pendingException;
  private SQLException serverError;

  public QueryExecutorImpl(Properties info, ResultHandler resultHandler) throws PSQLException {
    this.info = info;
    this.resultHandler = resultHandler;
    if (PGProperty.LOGGER.isPresent(info)) {
      Logger.setLoggerName(PGProperty.LOGGER.get(info));
    }
    this.statementCache = new StatementCache(PGProperty.PREPARE_THRESHOLD.getInt(info),
        PGProperty.PREPARED_STATEMENT_CACHE_QUERIES.getInt(info));
    this.framer = new MessageFramer(this, PGProperty.RECEIVE_BUFFER_SIZE.getInt(info));
  }

  // ---- transport side ----

  /**
   * @return the region the next received bytes must be written to
   */
  public ByteBuffer getBuffer() {
    return framer.getBuffer();
  }

  /**
   * Processes {@code count} bytes written into the region returned by {@link #getBuffer()}.
   *
   * @param count bytes received
   * @throws SQLException on a protocol violation; the connection is unusable afterwards
   */
  public void bufferUpdated(int count) throws SQLException {
    try {
      framer.bufferUpdated(count);
    } catch (SQLException e) {
      closed = true;
      throw e;
    }
  }

  public MessageFramer getFramer() {
    return framer;
  }

  // ---- session side ----

  /**
   * Builds the startup message. The ReadyForQuery that completes the startup is reported to the
   * {@link ResultHandler} like the end of any other request.
   *
   * @return bytes to send
   * @throws PSQLException if no user is configured
   */
  public byte[] startup() throws PSQLException {
    String user = PGProperty.USER.get(info);
    if (user == null) {
      throw new PSQLException(GT.tr("The user property is missing. It is mandatory."),
          PSQLState.INVALID_PARAMETER_VALUE);
    }
    Map<String, String> params = new LinkedHashMap<String, String>();
    params.put("user", user);
    String database = PGProperty.PG_DBNAME.get(info);
    params.put("database", database != null ? database : user);
    String applicationName = PGProperty.APPLICATION_NAME.get(info);
    if (applicationName != null) {
      params.put("application_name", applicationName);
    }
    String tz = PGProperty.TIMEZONE.get(info);
    if (tz != null) {
      params.put("TimeZone", tz);
    }
    params.put("DateStyle", "ISO");
    params.put("client_encoding", "UTF8");
    byte[] request = new MessageBuilder().startup(params).toByteArray();
    beginCycle(null, null, false, Format.TEXT, false, null);
    return request;
  }

  /**
   * Builds the request for one statement execution.
   *
   * @param sql statement text; several statements are allowed only without parameters
   * @param params parameter values, may be null
   * @param resultFormat requested result format; {@link Format#DEFAULT} picks text for the simple
   *        protocol and binary otherwise
   * @param raw return every column as {@code String} (text) or {@code byte[]} (binary)
   * @param sink receives the data of a {@code COPY ... TO STDOUT}, may be null
   * @return bytes to send
   * @throws SQLException on invalid input, or if the executor is closed or busy
   */
  public byte[] execute(String sql, Object[] params, Format resultFormat, boolean raw, OutputStream sink)
      throws SQLException {
    if (closed) {
      throw new PSQLException(GT.tr("This connection has been closed."), PSQLState.CONNECTION_DOES_NOT_EXIST);
    }
    if (cycleActive) {
      throw new PSQLException(GT.tr("Another request is still in progress"), PSQLState.OBJECT_NOT_IN_STATE);
    }
    if (resultFormat == null) {
      throw new PSQLException(GT.tr("Invalid result format: {0}", resultFormat), PSQLState.INVALID_PARAMETER_VALUE);
    }
    ParameterInfo[] encoded = ParameterEncoder.encodeAll(params);
    if (encoded.length > MessageBuilder.MAX_PARAMETERS) {
      throw new PSQLException(GT.tr("Too many parameters: {0}, at most {1} are supported", encoded.length,
          MessageBuilder.MAX_PARAMETERS), PSQLState.INVALID_PARAMETER_VALUE);
    }
    StatementKey key = null;
    CachedStatement entry = null;
    if (statementCache.isEnabled()) {
      key = new StatementKey(sql, ParameterEncoder.typeOids(encoded));
      entry = statementCache.get(key);
    }

    MessageBuilder builder = new MessageBuilder();
    if (encoded.length == 0 && resultFormat != Format.BINARY && entry == null) {
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(" FE=> SimpleQuery(query=\"" + sql + "\")");
      }
      builder.query(sql);
      beginCycle(key, null, false, Format.TEXT, raw, sink);
      return builder.toByteArray();
    }

    Format format = resultFormat == Format.DEFAULT ? Format.BINARY : resultFormat;
    // queued Closes stay queued until the whole request has been built
    for (String name : statementCache.peekStatementsToClose()) {
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(" FE=> CloseStatement(" + name + ")");
      }
      builder.closeStatement(name);
    }
    boolean wasPrepared = entry != null && entry.isPrepared();
    String statementName = "";
    boolean parseNamed = false;
    if (wasPrepared) {
      statementName = entry.getName();
    } else {
      parseNamed = statementCache.shouldPrepare(entry);
      if (parseNamed) {
        statementName = entry.getName();
      }
      int[] oids = ParameterEncoder.typeOids(encoded);
      if (LOGGER.isDebugEnabled()) {
        StringBuilder sbuf = new StringBuilder(" FE=> Parse(stmt=" + statementName + ",query=\"");
        sbuf.append(sql);
        sbuf.append("\",oids={");
        for (int i = 0; i < oids.length; ++i) {
          if (i != 0) {
            sbuf.append(",");
          }
          sbuf.append(oids[i]);
        }
        sbuf.append("})");
        LOGGER.debug(sbuf.toString());
      }
      builder.parse(statementName, sql, oids);
    }
    if (LOGGER.isDebugEnabled()) {
      StringBuilder sbuf = new StringBuilder(" FE=> Bind(stmt=" + statementName + ",portal=null");
      for (int i = 0; i < encoded.length; ++i) {
        sbuf.append(",$").append(i + 1).append("=<").append(encoded[i]).append(">");
      }
      sbuf.append(")");
      LOGGER.debug(sbuf.toString());
    }
    builder.bind("", statementName, encoded, format);
    boolean reuseDescription = wasPrepared && !raw && entry.isDescribedFor(format);
    if (!reuseDescription) {
      LOGGER.debug(" FE=> Describe(portal=null)");
      builder.describePortal("");
    }
    LOGGER.debug(" FE=> Execute(portal=null,limit=0)");
    builder.execute("", 0);
    LOGGER.debug(" FE=> Sync");
    builder.sync();

    statementCache.takeStatementsToClose();
    beginCycle(key, entry, wasPrepared, format, raw, sink);
    namedParsePending = parseNamed;
    if (reuseDescription) {
      currentFields = entry.getFields();
      currentConverters = entry.getConverters();
    }
    return builder.toByteArray();
  }

  /**
   * @return Terminate message; the executor is closed afterwards
   */
  public byte[] terminate() {
    closed = true;
    LOGGER.debug(" FE=> Terminate");
    return new MessageBuilder().terminate().toByteArray();
  }

  /**
   * @return a CancelRequest for this session, to be sent over a separate connection
   * @throws PSQLException if the server has not sent BackendKeyData
   */
  public byte[] cancelRequest() throws PSQLException {
    if (backendPid == 0) {
      throw new PSQLException(GT.tr("No backend key data received; the request cannot be cancelled"),
          PSQLState.OBJECT_NOT_IN_STATE);
    }
    return new MessageBuilder().cancelRequest(backendPid, backendSecretKey).toByteArray();
  }

  private void beginCycle(StatementKey key, CachedStatement entry, boolean wasPrepared, Format format,
      boolean raw, OutputStream sink) {
    cycleActive = true;
    cycleKey = key;
    cycleEntry = entry;
    cycleWasPrepared = wasPrepared;
    namedParsePending = false;
    cycleFormat = format;
    cycleRaw = raw;
    cycleSink = sink;
    copyOutActive = false;
    copyOutFailed = false;
    currentFields = null;
    currentConverters = null;
    currentRows = null;
    results = new ArrayList<Result>();
    pendingException = null;
    serverError = null;
  }

  private void endCycle() {
    cycleActive = false;
    cycleKey = null;
    cycleEntry = null;
    cycleSink = null;
    namedParsePending = false;
    copyOutActive = false;
    currentFields = null;
    currentConverters = null;
    currentRows = null;
    results = new ArrayList<Result>();
    pendingException = null;
    serverError = null;
  }

  // ---- backend messages ----

  @Override
  public void handleMessage(char tag, MessageReader body) throws SQLException {
    switch (tag) {
      case 'A': // Asynchronous Notify
        receiveAsyncNotify(body);
        break;

      case '1': // Parse Complete (response to Parse)
        LOGGER.debug(" <=BE ParseComplete");
        if (namedParsePending) {
          namedParsePending = false;
          statementCache.onParseComplete(cycleEntry);
        }
        break;

      case '2': // Bind Complete (response to Bind)
        LOGGER.debug(" <=BE BindComplete");
        break;

      case '3': // Close Complete (response to Close)
        LOGGER.debug(" <=BE CloseComplete");
        statementCache.onCloseComplete();
        break;

      case 'n': // No Data (response to Describe)
        LOGGER.debug(" <=BE NoData");
        currentFields = null;
        currentConverters = null;
        publishDescription();
        break;

      case 't': // ParameterDescription
        receiveParameterDescription(body);
        break;

      case 'T': // Row Description (response to Describe)
        receiveFields(body);
        publishDescription();
        break;

      case 'D': // Data Transfer (ongoing Execute response)
        receiveDataRow(body);
        break;

      case 'C': // Command Status (end of Execute)
        receiveCommandStatus(body);
        break;

      case 'I': // Empty Query (end of Execute)
        LOGGER.debug(" <=BE EmptyQuery");
        results.add(new Result(null, null, "EMPTY"));
        currentFields = null;
        currentRows = null;
        break;

      case 'E': // Error Response (the backend then skips until Sync)
        receiveErrorResponse(body);
        break;

      case 'N': // Notice Response (warnings / info)
        receiveNoticeResponse(body);
        break;

      case 'S': // Parameter Status
        receiveParameterStatus(body);
        break;

      case 'K': // Backend Key Data
        backendPid = body.readInt4();
        backendSecretKey = body.readInt4();
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug(" <=BE BackendKeyData(pid=" + backendPid + ")");
        }
        break;

      case 'R': // Authentication request
        if (body.remaining() == 4 && ByteConverter.int4(body.getBuffer(), body.position()) == 0) {
          body.readInt4();
          LOGGER.debug(" <=BE AuthenticationOk");
        } else {
          fallbackHandler.handleMessage(tag, body);
        }
        break;

      case 'H': // CopyOutResponse
        receiveCopyOutResponse(body);
        break;

      case 'd': // CopyData
        receiveCopyData(body);
        break;

      case 'c': // CopyDone
        LOGGER.debug(" <=BE CopyDone");
        copyOutActive = false;
        break;

      case 'Z': // Ready For Query (eventual response to Sync)
        receiveRFQ(body);
        break;

      default:
        fallbackHandler.handleMessage(tag, body);
        break;
    }
  }

  private void receiveAsyncNotify(MessageReader body) throws PSQLException {
    int pid = body.readInt4();
    String channel = body.readString();
    String payload = body.readString();
    Notification notification = new Notification(pid, channel, payload);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" <=BE AsyncNotify(" + pid + "," + channel + "," + payload + ")");
    }
    if (notificationListener != null) {
      notificationListener.notificationReceived(notification);
    }
  }

  private void receiveParameterDescription(MessageReader body) throws PSQLException {
    int count = body.readUInt2();
    StringBuilder sbuf = new StringBuilder(" <=BE ParameterDescription(");
    for (int i = 0; i < count; i++) {
      if (i != 0) {
        sbuf.append(",");
      }
      sbuf.append(Oid.toString(body.readInt4()));
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(sbuf.append(")").toString());
    }
  }

  private void receiveFields(MessageReader body) throws PSQLException {
    int size = body.readUInt2();
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" <=BE RowDescription(" + size + ")");
    }
    List<Field> fields = new ArrayList<Field>(size);
    TypeConverter[] converters = new TypeConverter[size];
    for (int i = 0; i < size; i++) {
      String columnLabel = body.readString();
      int tableOid = body.readInt4();
      int positionInTable = body.readUInt2();
      int typeOid = body.readInt4();
      int typeLength = body.readInt2();
      int typeModifier = body.readInt4();
      int formatCode = body.readInt2();
      if (formatCode != 0 && formatCode != 1) {
        throw new PSQLException(GT.tr("Invalid format code {0} in RowDescription", formatCode),
            PSQLState.PROTOCOL_VIOLATION);
      }
      Format format = formatCode == 1 ? Format.BINARY : Format.TEXT;
      Field field = new Field(columnLabel, tableOid, positionInTable, typeOid, typeLength, typeModifier, format);
      fields.add(field);
      converters[i] = converterFor(typeOid, format);
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug("        " + field);
      }
    }
    currentFields = fields;
    currentConverters = converters;
    currentRows = new ArrayList<Object[]>();
  }

  private TypeConverter converterFor(int oid, Format format) {
    if (cycleRaw) {
      return format == Format.BINARY ? TextConverters.BYTES : TextConverters.TEXT;
    }
    ConverterPair custom = customConverters.get(oid);
    if (custom != null) {
      return custom.get(format);
    }
    return TypeRegistry.get(oid).get(format);
  }

  /**
   * Stores the row description on the prepared cache entry, so the next execution can skip
   * Describe.
   */
  private void publishDescription() {
    if (cycleEntry != null && cycleEntry.isPrepared() && !cycleRaw) {
      cycleEntry.setDescription(cycleFormat, currentFields, currentConverters);
    }
  }

  private void receiveDataRow(MessageReader body) throws PSQLException {
    if (currentFields == null) {
      throw new PSQLException(GT.tr("Received DataRow without a preceding RowDescription"),
          PSQLState.PROTOCOL_VIOLATION);
    }
    int count = body.readUInt2();
    if (count != currentFields.size()) {
      throw new PSQLException(GT.tr("DataRow has {0} columns, but RowDescription announced {1}",
          count, currentFields.size()), PSQLState.PROTOCOL_VIOLATION);
    }
    byte[] buf = body.getBuffer();
    Object[] row = new Object[count];
    boolean failed = false;
    for (int i = 0; i < count; i++) {
      int length = body.readInt4();
      if (length == -1) {
        continue;
      }
      if (length < 0 || length > body.remaining()) {
        throw new PSQLException(GT.tr("Invalid length {0} for column {1} of DataRow", length, i + 1),
            PSQLState.PROTOCOL_VIOLATION);
      }
      int offset = body.position();
      body.skip(length);
      if (failed) {
        continue;
      }
      try {
        row[i] = currentConverters[i].decode(this, buf, offset, length);
      } catch (SQLException e) {
        failed = true;
        setPendingException(e);
      } catch (RuntimeException e) {
        failed = true;
        setPendingException(new PSQLException(GT.tr("Cannot decode column {0} of type {1}",
            currentFields.get(i).getColumnLabel(), Oid.toString(currentFields.get(i).getOid())),
            PSQLState.DATA_ERROR, e));
      }
    }
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace(" <=BE DataRow(len=" + body.position() + ")");
    }
    if (!failed) {
      if (currentRows == null) {
        currentRows = new ArrayList<Object[]>();
      }
      currentRows.add(row);
    }
  }

  private void receiveCommandStatus(MessageReader body) throws PSQLException {
    String status = body.readString();
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" <=BE CommandStatus(" + status + ")");
    }
    if (currentFields != null && currentRows == null) {
      currentRows = new ArrayList<Object[]>();
    }
    results.add(new Result(currentFields, currentRows, status));
    currentFields = null;
    currentConverters = null;
    currentRows = null;
    if (status.startsWith("DISCARD ALL") || status.startsWith("DEALLOCATE ALL")) {
      statementCache.invalidateAll();
    }
  }

  private void receiveErrorResponse(MessageReader body) throws PSQLException {
    ServerErrorMessage errorMsg = new ServerErrorMessage(body.getBuffer(), body.position(), body.remaining());
    body.skip(body.remaining());
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" <=BE ErrorMessage(" + errorMsg.toString() + ")");
    }
    PSQLException error = new PSQLException(errorMsg);
    currentFields = null;
    currentConverters = null;
    currentRows = null;
    if (errorMsg.isFatal()) {
      closed = true;
      endCycle();
      resultHandler.handleError(error);
      return;
    }
    if (serverError == null) {
      serverError = error;
    }
    setPendingException(error);
  }

  private void receiveNoticeResponse(MessageReader body) throws PSQLException {
    ServerErrorMessage warnMsg = new ServerErrorMessage(body.getBuffer(), body.position(), body.remaining());
    body.skip(body.remaining());
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" <=BE NoticeResponse(" + warnMsg.toString() + ")");
    }
    if (noticeListener != null) {
      noticeListener.noticeReceived(new SQLWarning(warnMsg.toString(), warnMsg.getSQLState()));
    }
  }

  private void receiveParameterStatus(MessageReader body) throws PSQLException {
    String name = body.readString();
    String value = body.readString();
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" <=BE ParameterStatus(" + name + " = " + value + ")");
    }
    parameterStatuses.put(name, value);

    if (name.equals("client_encoding") && !value.equalsIgnoreCase("UTF8")) {
      closed = true; // we can't trust any subsequent string.
      throw new PSQLException(GT.tr(
          "The server''s client_encoding parameter was changed to {0}. UTF8 is required for correct operation.",
          value), PSQLState.CONNECTION_FAILURE);
    }
    if (name.equals("DateStyle")) {
      isoDates = value.startsWith("ISO,");
    }
    if (name.equals("TimeZone")) {
      try {
        timeZone = ZoneId.of(value);
      } catch (DateTimeException e) {
        LOGGER.debug("Cannot use server time zone " + value, e);
      }
    }
    if (name.equals("IntervalStyle")) {
      intervalStyle = value;
    }
    if (name.equals("standard_conforming_strings")) {
      standardConformingStrings = value.equals("on");
    }
  }

  private void receiveCopyOutResponse(MessageReader body) throws PSQLException {
    int format = body.readByte();
    int columns = body.readUInt2();
    body.skip(2 * columns);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" <=BE CopyOutResponse(format=" + format + ",columns=" + columns + ")");
    }
    copyOutActive = true;
    copyOutFailed = false;
    if (cycleSink == null) {
      copyOutFailed = true;
      setPendingException(new PSQLException(GT.tr("COPY TO STDOUT needs an output stream for the data"),
          PSQLState.OBJECT_NOT_IN_STATE));
    }
  }

  private void receiveCopyData(MessageReader body) throws PSQLException {
    if (!copyOutActive) {
      throw new PSQLException(GT.tr("Received CopyData outside of COPY OUT"), PSQLState.PROTOCOL_VIOLATION);
    }
    int offset = body.position();
    int length = body.remaining();
    body.skip(length);
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace(" <=BE CopyData(" + length + ")");
    }
    if (copyOutFailed) {
      return;
    }
    try {
      cycleSink.write(body.getBuffer(), offset, length);
    } catch (IOException e) {
      copyOutFailed = true;
      setPendingException(new PSQLException(GT.tr("Writing COPY data failed"), PSQLState.IO_ERROR, e));
    }
  }

  private void receiveRFQ(MessageReader body) throws SQLException {
    int status = body.readByte();
    TransactionState state = TransactionState.fromIndicator(status);
    if (state == null) {
      throw new PSQLException(GT.tr("Unexpected transaction state in ReadyForQuery: {0}", status),
          PSQLState.PROTOCOL_VIOLATION);
    }
    transactionState = state;
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" <=BE ReadyForQuery(" + (char) status + ")");
    }
    if (!cycleActive) {
      return;
    }
    if (serverError != null || pendingException == null) {
      statementCache.afterExecution(cycleKey, cycleEntry, cycleWasPrepared, serverError, results.size());
    } else {
      // a result could not be decoded; the statement itself is fine
      statementCache.afterExecution(null, null, false, null, 0);
    }
    List<Result> cycleResults = results;
    SQLException error = pendingException;
    endCycle();
    if (error != null) {
      resultHandler.handleError(error);
    } else {
      resultHandler.handleResult(cycleResults);
    }
  }

  private void setPendingException(SQLException e) {
    if (pendingException == null) {
      pendingException = e;
    } else {
      pendingException.setNextException(e);
    }
  }

  // ---- DecodeContext ----

  @Override
  public boolean isIsoDates() {
    return isoDates;
  }

  @Override
  public ZoneId getTimeZone() {
    return timeZone;
  }

  @Override
  public String getIntervalStyle() {
    return intervalStyle;
  }

  // ---- configuration and state ----

  /**
   * Overrides the converters of one type for this connection. Converters must be pure: they run
   * while a message is being dispatched.
   *
   * @param oid type OID
   * @param converters text and binary converter
   */
  public void registerConverter(int oid, ConverterPair converters) {
    customConverters.put(oid, converters);
  }

  public void unregisterConverter(int oid) {
    customConverters.remove(oid);
  }

  public void setFallbackHandler(MessageHandler fallbackHandler) {
    this.fallbackHandler = fallbackHandler == null ? UNEXPECTED_MESSAGE_HANDLER : fallbackHandler;
  }

  public void setNoticeListener(NoticeListener noticeListener) {
    this.noticeListener = noticeListener;
  }

  public void setNotificationListener(NotificationListener notificationListener) {
    this.notificationListener = notificationListener;
  }

  public TransactionState getTransactionState() {
    return transactionState;
  }

  public Map<String, String> getParameterStatuses() {
    return Collections.unmodifiableMap(parameterStatuses);
  }

  public String getParameterStatus(String name) {
    return parameterStatuses.get(name);
  }

  public boolean getStandardConformingStrings() {
    return standardConformingStrings;
  }

  public int getBackendPID() {
    return backendPid;
  }

  public int getPrepareThreshold() {
    return statementCache.getPrepareThreshold();
  }

  public void setPrepareThreshold(int prepareThreshold) {
    statementCache.setPrepareThreshold(prepareThreshold);
  }

  public int getStatementCacheSize() {
    return statementCache.getMaxSize();
  }

  public void setStatementCacheSize(int size) {
    statementCache.setMaxSize(size);
  }

  public StatementCache getStatementCache() {
    return statementCache;
  }

  public boolean isClosed() {
    return closed;
  }

  public boolean isRequestInProgress() {
    return cycleActive;
  }
}
