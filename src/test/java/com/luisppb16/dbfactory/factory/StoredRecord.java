/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.factory;

record StoredRecord(long id, String table, String name, Long parentId) {}
